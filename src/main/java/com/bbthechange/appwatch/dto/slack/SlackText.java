package com.bbthechange.appwatch.dto.slack;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Slack Block Kit text object.
 */
@Getter
@EqualsAndHashCode
@ToString
public class SlackText {

    private final String type;
    private final String text;

    private SlackText(String type, String text) {
        this.type = type;
        this.text = text;
    }

    public static SlackText plain(String text) {
        return new SlackText("plain_text", text);
    }

    public static SlackText markdown(String text) {
        return new SlackText("mrkdwn", text);
    }
}
