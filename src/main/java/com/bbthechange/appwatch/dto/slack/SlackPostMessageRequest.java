package com.bbthechange.appwatch.dto.slack;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request body for Slack's chat.postMessage.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"channel", "text", "blocks"})
public class SlackPostMessageRequest {

    private String channel;
    private String text;
    private List<SlackBlock> blocks;
}
