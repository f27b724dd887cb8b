package com.chicu.airetrain.data;

public interface DataReadinessClient {

    DataReadiness check(String targetId);
}
