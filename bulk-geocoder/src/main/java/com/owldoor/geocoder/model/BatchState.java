package com.owldoor.geocoder.model;

public enum BatchState {
    IDLE, INITIALIZING, RUNNING, COMPLETED, ABORTED
}
