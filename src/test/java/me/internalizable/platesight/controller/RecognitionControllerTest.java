package me.internalizable.platesight.controller;

import me.internalizable.platesight.audit.AuditStatistics;
import me.internalizable.platesight.audit.RecognitionAuditLog;
import me.internalizable.platesight.cache.CacheStats;
import me.internalizable.platesight.cache.RecognitionCache;
import me.internalizable.platesight.dedup.DuplicateSuppressor;
import me.internalizable.platesight.image.ImageDecoder;
import me.internalizable.platesight.image.InvalidImageException;
import me.internalizable.platesight.model.CapturedImage;
import me.internalizable.platesight.model.PlateCategory;
import me.internalizable.platesight.model.PlateResult;
import me.internalizable.platesight.model.RecognitionError;
import me.internalizable.platesight.model.RecognitionErrorCode;
import me.internalizable.platesight.model.RecognitionMode;
import me.internalizable.platesight.ratelimit.RateLimitStats;
import me.internalizable.platesight.ratelimit.RateLimiter;
import me.internalizable.platesight.service.RecognitionOutcome;
import me.internalizable.platesight.service.RecognitionPipeline;
import me.internalizable.platesight.support.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RecognitionController.class)
class RecognitionControllerTest {

    private static final String RECOGNIZE = "/api/license-plate/recognize";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private RecognitionPipeline pipeline;

    @MockBean
    private ImageDecoder imageDecoder;

    @MockBean
    private RecognitionCache cache;

    @MockBean
    private RateLimiter rateLimiter;

    @MockBean
    private DuplicateSuppressor duplicateSuppressor;

    @MockBean
    private RecognitionAuditLog auditLog;

    private static PlateResult plate() {
        return PlateResult.of("品川", "330", "わ", "12-34", 91, PlateCategory.RENTAL_OR_SHARED,
                Instant.parse("2024-05-01T09:00:00Z"));
    }

    @Test
    void recognizeReturnsPlate() throws Exception {
        CapturedImage frame = TestImages.sharpFrame(1);
        when(imageDecoder.decode("abc")).thenReturn(frame);
        when(pipeline.recognize(frame, RecognitionMode.SINGLE))
                .thenReturn(RecognitionOutcome.success(plate(), false, "hash", 42));

        mockMvc.perform(post(RECOGNIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"abc\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.fullText").value("品川330わ12-34"))
                .andExpect(jsonPath("$.data.plateCategory").value("RENTAL_OR_SHARED"))
                .andExpect(jsonPath("$.fromCache").value(false))
                .andExpect(jsonPath("$.duplicate").value(false))
                .andExpect(jsonPath("$.processingTime").value(42));
    }

    @Test
    void realtimeModeIsPassedThroughAndDuplicatesAreFlagged() throws Exception {
        CapturedImage frame = TestImages.sharpFrame(2);
        when(imageDecoder.decode("abc")).thenReturn(frame);
        when(pipeline.recognize(frame, RecognitionMode.REALTIME))
                .thenReturn(RecognitionOutcome.suppressed(true, "hash", 3));

        mockMvc.perform(post(RECOGNIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"abc\",\"mode\":\"realtime\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.duplicate").value(true))
                .andExpect(jsonPath("$.fromCache").value(true));
    }

    @ParameterizedTest
    @CsvSource({
            "INVALID_IMAGE, 400",
            "PLATE_NOT_RECOGNIZED, 422",
            "RATE_LIMITED, 429",
            "API_CONNECTION_FAILED, 502",
            "REQUEST_CANCELLED, 503",
            "TIMEOUT, 504"
    })
    void failuresMapToHttpStatus(RecognitionErrorCode code, int httpStatus) throws Exception {
        CapturedImage frame = TestImages.sharpFrame(3);
        when(imageDecoder.decode(anyString())).thenReturn(frame);
        when(pipeline.recognize(eq(frame), any(RecognitionMode.class)))
                .thenReturn(RecognitionOutcome.failed(RecognitionError.of(code), "hash", 7));

        mockMvc.perform(post(RECOGNIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"abc\"}"))
                .andExpect(status().is(httpStatus))
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value(code.name()))
                .andExpect(jsonPath("$.error.suggestion").value(code.defaultSuggestion()));
    }

    @Test
    void undecodableImageIsBadRequest() throws Exception {
        when(imageDecoder.decode(anyString())).thenThrow(new InvalidImageException("Unsupported image format"));

        mockMvc.perform(post(RECOGNIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":\"bm90IGFuIGltYWdl\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_IMAGE"))
                .andExpect(jsonPath("$.error.message").value("Unsupported image format"));

        verify(pipeline, never()).recognize(any(), any());
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post(RECOGNIZE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"image\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_IMAGE"));
    }

    @Test
    void statsCombineEveryComponent() throws Exception {
        when(cache.getStats()).thenReturn(CacheStats.of(3, 1, 2));
        when(rateLimiter.getStats()).thenReturn(new RateLimitStats(1, 4, 100, 100, 60_000));
        when(duplicateSuppressor.size()).thenReturn(5);
        when(duplicateSuppressor.getMaxHistory()).thenReturn(100);
        when(duplicateSuppressor.getSuppressionDuration()).thenReturn(Duration.ofMillis(5000));
        when(auditLog.getStatistics()).thenReturn(new AuditStatistics(4, 3, 1, 75.0, 12.5,
                Map.of(RecognitionErrorCode.TIMEOUT, 1L)));

        mockMvc.perform(get("/api/recognition/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cache.hits").value(3))
                .andExpect(jsonPath("$.cache.hitRate").value(0.75))
                .andExpect(jsonPath("$.rateLimit.requestsInWindow").value(4))
                .andExpect(jsonPath("$.suppression.size").value(5))
                .andExpect(jsonPath("$.suppression.suppressionDurationMs").value(5000))
                .andExpect(jsonPath("$.recognitions.successRate").value(75.0))
                .andExpect(jsonPath("$.recognitions.errorCounts.TIMEOUT").value(1));
    }

    @Test
    void clearEndpointsResetState() throws Exception {
        mockMvc.perform(post("/api/cache/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
        mockMvc.perform(post("/api/suppression/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        verify(cache).clear();
        verify(duplicateSuppressor).clear();
    }

    @Test
    void healthIsOk() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(content().string("OK"));
    }
}
