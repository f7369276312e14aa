package com.egg.pipeline;

public enum InferenceMode {
    SINGLE,
    BATCH
}
