package me.internalizable.platesight.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DashScopeRequest(
        String model,
        Input input,
        Parameters parameters
) {

    public record Input(List<Message> messages) {}

    public record Message(String role, List<Content> content) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Content(String image, String text) {

        public static Content image(String dataUrl) {
            return new Content(dataUrl, null);
        }

        public static Content text(String text) {
            return new Content(null, text);
        }
    }

    public record Parameters(@JsonProperty("result_format") String resultFormat) {}

    public static DashScopeRequest forPlateImage(String model, String imageDataUrl, String prompt) {
        Message message = new Message("user", List.of(Content.image(imageDataUrl), Content.text(prompt)));
        return new DashScopeRequest(model, new Input(List.of(message)), new Parameters("message"));
    }
}
