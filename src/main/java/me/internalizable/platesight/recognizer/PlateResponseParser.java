package me.internalizable.platesight.recognizer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.internalizable.platesight.model.PlateCategory;
import me.internalizable.platesight.model.PlateResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the JSON object the vision model was asked to answer with.
 * Models sometimes wrap it in prose or code fences, so the outermost
 * {@code {...}} block is extracted first.
 */
@Component
public class PlateResponseParser {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private final ObjectMapper objectMapper;

    public PlateResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PlateReply(
            Boolean detected,
            String region,
            String classificationNumber,
            String hiragana,
            String serialNumber,
            String plateType,
            Double confidence
    ) {}

    /**
     * @throws RecognitionException PARSE_ERROR (terminal) when no JSON object can be read
     */
    public RecognizerResponse parse(String rawText, Instant recognizedAt) {
        PlateReply reply = readReply(rawText);
        PlateResult plate = toPlateResult(reply, recognizedAt);
        return new RecognizerResponse(rawText, plate, plate != null ? plate.confidence() : 0);
    }

    PlateReply readReply(String rawText) {
        Matcher matcher = JSON_OBJECT.matcher(rawText != null ? rawText : "");
        if (!matcher.find()) {
            throw RecognitionException.terminal(RecognitionErrorKind.PARSE_ERROR, "No JSON object in recognizer reply");
        }
        try {
            return objectMapper.readValue(matcher.group(), PlateReply.class);
        } catch (JsonProcessingException e) {
            throw new RecognitionException(RecognitionErrorKind.PARSE_ERROR,
                    "Recognizer reply is not valid JSON", false, e);
        }
    }

    /**
     * @return null when no plate was detected or a plate field is missing
     */
    static PlateResult toPlateResult(PlateReply reply, Instant recognizedAt) {
        if (reply == null || !Boolean.TRUE.equals(reply.detected())) {
            return null;
        }
        if (isBlank(reply.region()) || isBlank(reply.classificationNumber())
                || isBlank(reply.hiragana()) || isBlank(reply.serialNumber())) {
            return null;
        }
        return PlateResult.of(
                reply.region(),
                reply.classificationNumber(),
                reply.hiragana(),
                reply.serialNumber(),
                clampConfidence(reply.confidence()),
                PlateCategory.resolve(reply.hiragana(), reply.plateType()),
                recognizedAt);
    }

    static int clampConfidence(Double confidence) {
        if (confidence == null || confidence.isNaN()) {
            return 0;
        }
        return (int) Math.round(Math.max(0, Math.min(100, confidence)));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
