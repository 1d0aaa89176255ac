package com.cronium.engine.model;

public enum RunLocation {
    LOCAL, REMOTE
}
