package com.example.boundedcache.config;

public enum RefreshMode {
    NAIVE,
    COALESCING
}
