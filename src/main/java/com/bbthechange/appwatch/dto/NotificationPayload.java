package com.bbthechange.appwatch.dto;

import com.bbthechange.appwatch.dto.slack.SlackBlock;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One consolidated notification: a plain-text fallback plus its Block Kit layout.
 * The destination is added by the delivery channel.
 */
@Getter
@EqualsAndHashCode
@ToString
public class NotificationPayload {

    private final String text;
    private final List<SlackBlock> blocks;

    public NotificationPayload(String text, List<SlackBlock> blocks) {
        this.text = text;
        this.blocks = List.copyOf(blocks);
    }
}
