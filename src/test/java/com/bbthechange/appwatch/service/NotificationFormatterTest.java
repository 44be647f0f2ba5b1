package com.bbthechange.appwatch.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.bbthechange.appwatch.dto.NotificationPayload;
import com.bbthechange.appwatch.dto.slack.SlackBlock;
import com.bbthechange.appwatch.dto.slack.SlackText;
import com.bbthechange.appwatch.model.ChangeRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static com.bbthechange.appwatch.testutil.AppMetadataTestBuilder.anApp;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotificationFormatterTest {

    private NotificationFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new NotificationFormatter(NotificationFormatter.DEFAULT_RELEASE_NOTES_MAX_LENGTH);
    }

    private static List<String> blockTypes(NotificationPayload payload) {
        return payload.getBlocks().stream().map(SlackBlock::getType).collect(Collectors.toList());
    }

    @Test
    @DisplayName("should return empty for an empty change list")
    void format_NoChanges_ReturnsEmpty() {
        assertThat(formatter.format(List.of())).isEmpty();
        assertThat(formatter.format(null)).isEmpty();
    }

    @Test
    @DisplayName("should reject a non-positive release notes limit")
    void constructor_NonPositiveLimit_Throws() {
        assertThatThrownBy(() -> new NotificationFormatter(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("layout")
    class LayoutTests {

        @Test
        @DisplayName("should render header, one block per app and dividers only between apps")
        void format_ThreeChanges_HeaderBlocksAndDividers() {
            List<ChangeRecord> changes = List.of(
                    ChangeRecord.newRelease(anApp("A").withVersion("1.1").build(), "1.0"),
                    ChangeRecord.newRelease(anApp("B").withVersion("2.1").build(), "2.0"),
                    ChangeRecord.newRelease(anApp("C").withVersion("3.1").build(), "3.0"));

            NotificationPayload payload = formatter.format(changes).orElseThrow();

            assertThat(blockTypes(payload)).containsExactly(
                    SlackBlock.HEADER,
                    SlackBlock.SECTION, SlackBlock.DIVIDER,
                    SlackBlock.SECTION, SlackBlock.DIVIDER,
                    SlackBlock.SECTION);
        }

        @Test
        @DisplayName("should add no divider for a single app")
        void format_SingleChange_NoDivider() {
            NotificationPayload payload = formatter.format(List.of(
                    ChangeRecord.firstObservation(anApp("A").build()))).orElseThrow();

            assertThat(blockTypes(payload)).containsExactly(SlackBlock.HEADER, SlackBlock.SECTION);
        }

        @Test
        @DisplayName("should keep the order of the change list")
        void format_PreservesInputOrder() {
            NotificationPayload payload = formatter.format(List.of(
                    ChangeRecord.firstObservation(anApp("B").withName("Bravo").build()),
                    ChangeRecord.firstObservation(anApp("A").withName("Alpha").build()))).orElseThrow();

            List<String> names = payload.getBlocks().stream()
                    .filter(block -> block.getFields() != null)
                    .map(block -> block.getFields().get(0).getText())
                    .collect(Collectors.toList());
            assertThat(names).hasSize(2);
            assertThat(names.get(0)).contains("*Bravo*");
            assertThat(names.get(1)).contains("*Alpha*");
        }

        @Test
        @DisplayName("should render name, developer, version, timestamp and store link as fields")
        void format_AppBlock_HasAllFields() {
            ChangeRecord change = ChangeRecord.newRelease(anApp("42")
                    .withName("Rival")
                    .withDeveloper("Rival Inc.")
                    .withVersion("5.2")
                    .withLastUpdated(Instant.parse("2024-06-03T17:45:12Z"))
                    .withUrl("https://apps.apple.com/us/app/rival/id42")
                    .build(), "5.1");

            NotificationPayload payload = formatter.format(List.of(change)).orElseThrow();

            List<SlackText> fields = payload.getBlocks().get(1).getFields();
            assertThat(fields).extracting(SlackText::getType).containsOnly("mrkdwn");
            assertThat(fields).extracting(SlackText::getText).containsExactly(
                    "📱 *Rival*\nRival Inc.",
                    "*Version:* 5.2\n*Updated:* 2024-06-03 17:45 UTC",
                    "<https://apps.apple.com/us/app/rival/id42|📱 App Store>");
        }

        @Test
        @DisplayName("should print unknown when the release timestamp is absent")
        void format_NoTimestamp_PrintsUnknown() {
            NotificationPayload payload = formatter.format(List.of(
                    ChangeRecord.firstObservation(anApp("A").withLastUpdated(null).build()))).orElseThrow();

            assertThat(payload.getBlocks().get(1).getFields().get(1).getText())
                    .endsWith("*Updated:* unknown");
        }
    }

    @Nested
    @DisplayName("title and icons")
    class TitleTests {

        @Test
        @DisplayName("should use the release icon when every change is a new release")
        void title_OnlyNewReleases_ReleaseIcon() {
            NotificationPayload payload = formatter.format(List.of(
                    ChangeRecord.newRelease(anApp("A").build(), "0.9"),
                    ChangeRecord.newRelease(anApp("B").build(), "0.9"))).orElseThrow();

            assertThat(payload.getText()).isEqualTo("📱 Competitor App Updates (2)");
            assertThat(payload.getBlocks().get(0).getText()).isEqualTo(SlackText.plain(payload.getText()));
        }

        @Test
        @DisplayName("should use the first-observation icon when any change is a first observation")
        void title_MixedKinds_FirstObservationIcon() {
            NotificationPayload payload = formatter.format(List.of(
                    ChangeRecord.newRelease(anApp("A").build(), "0.9"),
                    ChangeRecord.firstObservation(anApp("B").build()))).orElseThrow();

            assertThat(payload.getText()).isEqualTo("🆕 Competitor App Updates (2)");
            assertThat(payload.getBlocks().get(1).getFields().get(0).getText()).startsWith("📱 ");
            assertThat(payload.getBlocks().get(3).getFields().get(0).getText()).startsWith("🆕 ");
        }
    }

    @Nested
    @DisplayName("release notes")
    class ReleaseNotesTests {

        @Test
        @DisplayName("should truncate notes over the limit and append the marker")
        void format_LongNotes_Truncated() {
            String notes = "x".repeat(600);

            NotificationPayload payload = formatter.format(List.of(
                    ChangeRecord.newRelease(anApp("A").withReleaseNotes(notes).build(), "1.0"))).orElseThrow();

            assertThat(blockTypes(payload)).containsExactly(SlackBlock.HEADER, SlackBlock.SECTION, SlackBlock.SECTION);
            String text = payload.getBlocks().get(2).getText().getText();
            assertThat(text).isEqualTo("*What's New:*\n```" + "x".repeat(500) + "...```");
        }

        @Test
        @DisplayName("should leave notes of exactly the limit untouched")
        void truncate_ExactlyAtLimit_Unchanged() {
            String notes = "y".repeat(500);

            assertThat(formatter.truncate(notes)).isEqualTo(notes);
        }

        @Test
        @DisplayName("should count code points, not UTF-16 units, against the limit")
        void truncate_EmojiUnderLimit_Unchanged() {
            String notes = "🎉".repeat(300);

            assertThat(formatter.truncate(notes)).isEqualTo(notes);
        }

        @Test
        @DisplayName("should keep a trailing surrogate pair intact at exactly the limit")
        void truncate_SurrogatePairAtLimit_Unchanged() {
            String notes = "x".repeat(499) + "🎉";

            assertThat(formatter.truncate(notes)).isEqualTo(notes);
        }

        @Test
        @DisplayName("should cut after whole code points when emoji notes exceed the limit")
        void truncate_EmojiOverLimit_CutOnCodePointBoundary() {
            String truncated = formatter.truncate("🎉".repeat(600));

            assertThat(truncated).isEqualTo("🎉".repeat(500) + "...");
            assertThat(truncated.codePointCount(0, truncated.length())).isEqualTo(503);
        }

        @Test
        @DisplayName("should honor a custom limit")
        void truncate_CustomLimit() {
            NotificationFormatter shortFormatter = new NotificationFormatter(5);

            assertThat(shortFormatter.truncate("Bug fixes")).isEqualTo("Bug f...");
        }

        @Test
        @DisplayName("should omit the notes block for empty or whitespace-only notes")
        void format_BlankNotes_NoNotesBlock() {
            NotificationPayload payload = formatter.format(List.of(
                    ChangeRecord.newRelease(anApp("A").withReleaseNotes("  \n\t ").build(), "1.0"),
                    ChangeRecord.newRelease(anApp("B").withReleaseNotes(null).build(), "1.0"))).orElseThrow();

            assertThat(blockTypes(payload)).containsExactly(
                    SlackBlock.HEADER, SlackBlock.SECTION, SlackBlock.DIVIDER, SlackBlock.SECTION);
        }
    }

    @Nested
    @DisplayName("mrkdwn escaping")
    class EscapingTests {

        @Test
        @DisplayName("should escape ampersand and angle brackets in names and developers")
        void format_ControlCharactersInName_Escaped() {
            NotificationPayload payload = formatter.format(List.of(ChangeRecord.newRelease(anApp("A")
                    .withName("Tom & Jerry <Kids>")
                    .withDeveloper("A&B Studios")
                    .build(), "1.0"))).orElseThrow();

            assertThat(payload.getBlocks().get(1).getFields().get(0).getText())
                    .isEqualTo("📱 *Tom &amp; Jerry &lt;Kids&gt;*\nA&amp;B Studios");
        }

        @Test
        @DisplayName("should escape notes and keep a literal code fence from closing the block")
        void format_NotesWithFenceAndBrackets_Escaped() {
            NotificationPayload payload = formatter.format(List.of(ChangeRecord.newRelease(anApp("A")
                    .withReleaseNotes("Use ```code``` & <b>bold</b>")
                    .build(), "1.0"))).orElseThrow();

            String text = payload.getBlocks().get(2).getText().getText();
            String body = text.substring("*What's New:*\n```".length(), text.length() - "```".length());
            assertThat(body).doesNotContain("```");
            assertThat(body).contains("&amp; &lt;b&gt;bold&lt;/b&gt;");
        }

        @Test
        @DisplayName("should truncate before escaping so entities are never split")
        void format_EscapedNotesOverLimit_TruncatedOnOriginalText() {
            NotificationFormatter shortFormatter = new NotificationFormatter(3);

            NotificationPayload payload = shortFormatter.format(List.of(ChangeRecord.newRelease(anApp("A")
                    .withReleaseNotes("a<bcdef")
                    .build(), "1.0"))).orElseThrow();

            assertThat(payload.getBlocks().get(2).getText().getText())
                    .isEqualTo("*What's New:*\n```a&lt;b...```");
        }
    }

    @Test
    @DisplayName("should warn when the message has more blocks than Slack accepts")
    void format_TooManyBlocks_LogsWarning() {
        Logger formatterLogger = (Logger) LoggerFactory.getLogger(NotificationFormatter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        formatterLogger.addAppender(appender);
        try {
            List<ChangeRecord> changes = new ArrayList<>();
            for (int i = 0; i < 17; i++) {
                changes.add(ChangeRecord.firstObservation(anApp("app" + i).withReleaseNotes("Fixes").build()));
            }

            NotificationPayload payload = formatter.format(changes).orElseThrow();

            assertThat(payload.getBlocks()).hasSize(51);
            assertThat(appender.list)
                    .anySatisfy(event -> {
                        assertThat(event.getLevel()).isEqualTo(Level.WARN);
                        assertThat(event.getFormattedMessage()).contains("51 blocks").contains("invalid_blocks");
                    });
        } finally {
            formatterLogger.detachAppender(appender);
        }
    }

    @Test
    @DisplayName("should not warn at exactly the Slack block limit")
    void format_AtBlockLimit_NoWarning() {
        Logger formatterLogger = (Logger) LoggerFactory.getLogger(NotificationFormatter.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        formatterLogger.addAppender(appender);
        try {
            List<ChangeRecord> changes = new ArrayList<>();
            for (int i = 0; i < 25; i++) {
                changes.add(ChangeRecord.firstObservation(anApp("app" + i).build()));
            }

            NotificationPayload payload = formatter.format(changes).orElseThrow();

            assertThat(payload.getBlocks()).hasSize(NotificationFormatter.SLACK_MAX_BLOCKS);
            assertThat(appender.list).noneMatch(event -> event.getLevel() == Level.WARN);
        } finally {
            formatterLogger.detachAppender(appender);
        }
    }

    @Test
    @DisplayName("should render the title identically regardless of the default locale")
    void format_NonLatinDigitLocale_SameTitle() {
        List<ChangeRecord> changes = List.of(ChangeRecord.newRelease(anApp("A").build(), "0.9"));
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));

            NotificationPayload payload = formatter.format(changes).orElseThrow();

            assertThat(payload.getText()).isEqualTo("📱 Competitor App Updates (1)");
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("should produce byte-identical JSON for equal inputs")
    void format_SameInput_DeterministicJson() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper();
        List<ChangeRecord> changes = List.of(
                ChangeRecord.newRelease(anApp("A").withReleaseNotes("Fixes").build(), "0.9"),
                ChangeRecord.firstObservation(anApp("B").build()));

        String first = objectMapper.writeValueAsString(formatter.format(changes).orElseThrow());
        String second = objectMapper.writeValueAsString(
                new NotificationFormatter(NotificationFormatter.DEFAULT_RELEASE_NOTES_MAX_LENGTH)
                        .format(List.copyOf(changes)).orElseThrow());

        assertThat(first).isEqualTo(second);
        assertThat(first).doesNotContain("\"fields\":null");
    }
}
