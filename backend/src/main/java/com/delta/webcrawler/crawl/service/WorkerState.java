package com.delta.webcrawler.crawl.service;

public enum WorkerState {
    IDLE,
    POPPING,
    FETCHING,
    EXTRACTING,
    PUSHING,
    RECORDING,
    STOPPED
}
