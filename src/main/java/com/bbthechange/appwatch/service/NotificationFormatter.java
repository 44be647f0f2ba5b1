package com.bbthechange.appwatch.service;

import com.bbthechange.appwatch.config.MonitorProperties;
import com.bbthechange.appwatch.dto.NotificationPayload;
import com.bbthechange.appwatch.dto.slack.SlackBlock;
import com.bbthechange.appwatch.dto.slack.SlackText;
import com.bbthechange.appwatch.model.AppMetadata;
import com.bbthechange.appwatch.model.ChangeRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Builds the single consolidated Slack message for the changes of one cycle.
 * Pure: equal input lists always produce equal payloads.
 */
@Component
public class NotificationFormatter {

    private static final Logger logger = LoggerFactory.getLogger(NotificationFormatter.class);

    public static final String FIRST_OBSERVATION_ICON = "🆕";
    public static final String NEW_RELEASE_ICON = "📱";
    public static final String TITLE_TEMPLATE = "%s Competitor App Updates (%d)";
    public static final String TRUNCATION_MARKER = "...";
    public static final int DEFAULT_RELEASE_NOTES_MAX_LENGTH = 500;

    /**
     * chat.postMessage rejects messages with more blocks than this ({@code invalid_blocks}).
     */
    public static final int SLACK_MAX_BLOCKS = 50;

    private static final String CODE_FENCE = "```";
    private static final String BROKEN_CODE_FENCE = "`\u200B`\u200B`";

    private static final DateTimeFormatter UPDATED_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);

    private final int releaseNotesMaxLength;

    @Autowired
    public NotificationFormatter(MonitorProperties properties) {
        this(properties.getReleaseNotesMaxLength());
    }

    public NotificationFormatter(int releaseNotesMaxLength) {
        if (releaseNotesMaxLength <= 0) {
            throw new IllegalArgumentException("releaseNotesMaxLength must be positive: " + releaseNotesMaxLength);
        }
        this.releaseNotesMaxLength = releaseNotesMaxLength;
    }

    /**
     * Format the changes of a cycle.
     *
     * @param changes changes in notification order
     * @return the payload, or empty when there is nothing to announce
     */
    public Optional<NotificationPayload> format(List<ChangeRecord> changes) {
        if (changes == null || changes.isEmpty()) {
            return Optional.empty();
        }

        String title = title(changes);
        List<SlackBlock> blocks = new ArrayList<>();
        blocks.add(SlackBlock.header(title));

        for (int i = 0; i < changes.size(); i++) {
            ChangeRecord change = changes.get(i);
            blocks.add(appBlock(change));

            AppMetadata metadata = change.getMetadata();
            if (metadata.hasReleaseNotes()) {
                blocks.add(SlackBlock.section(SlackText.markdown(
                        "*What's New:*\n" + CODE_FENCE + escapeNotes(truncate(metadata.getReleaseNotes()))
                                + CODE_FENCE)));
            }

            if (i < changes.size() - 1) {
                blocks.add(SlackBlock.divider());
            }
        }

        if (blocks.size() > SLACK_MAX_BLOCKS) {
            logger.warn("Notification for {} changes has {} blocks, above Slack's limit of {}; "
                    + "delivery will be rejected with invalid_blocks", changes.size(), blocks.size(), SLACK_MAX_BLOCKS);
        }

        return Optional.of(new NotificationPayload(title, blocks));
    }

    String title(List<ChangeRecord> changes) {
        boolean anyFirstObservation = changes.stream().anyMatch(ChangeRecord::isFirstObservation);
        String icon = anyFirstObservation ? FIRST_OBSERVATION_ICON : NEW_RELEASE_ICON;
        return String.format(Locale.ROOT, TITLE_TEMPLATE, icon, changes.size());
    }

    private SlackBlock appBlock(ChangeRecord change) {
        AppMetadata metadata = change.getMetadata();
        String icon = change.isFirstObservation() ? FIRST_OBSERVATION_ICON : NEW_RELEASE_ICON;
        String updated = metadata.getLastUpdated()
                .map(instant -> UPDATED_FORMAT.format(instant) + " UTC")
                .orElse("unknown");

        return SlackBlock.fields(List.of(
                SlackText.markdown(icon + " *" + escape(metadata.getName()) + "*\n" + escape(metadata.getDeveloper())),
                SlackText.markdown("*Version:* " + escape(metadata.getVersion()) + "\n*Updated:* " + updated),
                SlackText.markdown("<" + metadata.getUrl() + "|" + NEW_RELEASE_ICON + " App Store>")
        ));
    }

    /**
     * Cut notes longer than the limit and mark the cut; shorter notes are returned unchanged.
     * The limit counts Unicode code points, so surrogate pairs are never split.
     */
    String truncate(String notes) {
        if (notes.codePointCount(0, notes.length()) <= releaseNotesMaxLength) {
            return notes;
        }
        return notes.substring(0, notes.offsetByCodePoints(0, releaseNotesMaxLength)) + TRUNCATION_MARKER;
    }

    /**
     * Escape the three control characters Slack mrkdwn reserves.
     */
    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;");
    }

    /**
     * Escape notes for use inside a code block; a literal fence would close the block early.
     */
    static String escapeNotes(String notes) {
        return escape(notes).replace(CODE_FENCE, BROKEN_CODE_FENCE);
    }
}
