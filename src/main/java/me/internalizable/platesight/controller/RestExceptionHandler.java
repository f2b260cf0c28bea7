package me.internalizable.platesight.controller;

import me.internalizable.platesight.dto.RecognizeResponse;
import me.internalizable.platesight.image.InvalidImageException;
import me.internalizable.platesight.model.RecognitionError;
import me.internalizable.platesight.model.RecognitionErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(RestExceptionHandler.class);

    private static final String IMAGE_SUGGESTION = "Send a JPEG or PNG image as base64 or a data URL";

    @ExceptionHandler(InvalidImageException.class)
    public ResponseEntity<RecognizeResponse> handleInvalidImage(InvalidImageException exception) {
        logger.warn("Rejected undecodable image: {}", exception.getMessage());
        return badRequest(exception.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<RecognizeResponse> handleUnreadableBody(HttpMessageNotReadableException exception) {
        logger.warn("Rejected malformed recognition request: {}", exception.getMostSpecificCause().getMessage());
        return badRequest("Malformed recognition request");
    }

    private ResponseEntity<RecognizeResponse> badRequest(String message) {
        RecognitionError error = new RecognitionError(RecognitionErrorCode.INVALID_IMAGE, message, IMAGE_SUGGESTION);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(RecognizeResponse.error(error));
    }
}
