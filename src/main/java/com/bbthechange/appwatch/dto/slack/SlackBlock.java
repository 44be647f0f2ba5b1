package com.bbthechange.appwatch.dto.slack;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Slack Block Kit layout block. Only the header, section and divider types are produced.
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "text", "fields"})
public class SlackBlock {

    public static final String HEADER = "header";
    public static final String SECTION = "section";
    public static final String DIVIDER = "divider";

    private final String type;
    private final SlackText text;
    private final List<SlackText> fields;

    private SlackBlock(String type, SlackText text, List<SlackText> fields) {
        this.type = type;
        this.text = text;
        this.fields = fields == null ? null : List.copyOf(fields);
    }

    public static SlackBlock header(String text) {
        return new SlackBlock(HEADER, SlackText.plain(text), null);
    }

    public static SlackBlock section(SlackText text) {
        return new SlackBlock(SECTION, text, null);
    }

    public static SlackBlock fields(List<SlackText> fields) {
        return new SlackBlock(SECTION, null, fields);
    }

    public static SlackBlock divider() {
        return new SlackBlock(DIVIDER, null, null);
    }
}
