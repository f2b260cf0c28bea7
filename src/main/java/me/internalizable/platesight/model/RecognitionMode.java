package me.internalizable.platesight.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum RecognitionMode {
    @JsonProperty("single")
    SINGLE,
    @JsonProperty("realtime")
    REALTIME
}
