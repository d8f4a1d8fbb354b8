package com.datalab.pairs;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * A derived training example: {@code user} is the prompt, {@code assistant} the completion.
 */
@JsonPropertyOrder({ "user", "assistant" })
public record ExportPair(String user, String assistant) {
}
