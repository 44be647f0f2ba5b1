package com.bbthechange.appwatch.dto.slack;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Envelope returned by every Slack Web API method. HTTP 200 does not imply success; check {@code ok}.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SlackApiResponse {

    private boolean ok;
    private String error;
    private String ts;
}
