package com.cronium.engine.model;

public enum ActionEffect {
    SEND_MESSAGE, RUN_EVENT
}
