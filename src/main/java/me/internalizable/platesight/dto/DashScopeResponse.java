package me.internalizable.platesight.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record DashScopeResponse(
        Output output,
        Usage usage,
        @JsonProperty("request_id") String requestId
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Output(List<Choice> choices) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Choice(
            @JsonProperty("finish_reason") String finishReason,
            Message message
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Message(String role, List<Content> content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Content(String text) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Usage(
            @JsonProperty("input_tokens") Integer inputTokens,
            @JsonProperty("output_tokens") Integer outputTokens
    ) {}

    public String getText() {
        if (output == null || output.choices() == null || output.choices().isEmpty()) {
            return null;
        }
        var message = output.choices().get(0).message();
        if (message == null || message.content() == null || message.content().isEmpty()) {
            return null;
        }
        return message.content().get(0).text();
    }
}
