package com.supplyplanner.service;

import com.supplyplanner.dto.RunStage;

/**
 * Notified as the pipeline enters each stage. Throwing aborts the run before the stage starts.
 */
@FunctionalInterface
public interface StageListener {

    StageListener NONE = stage -> { };

    void entering(RunStage stage);
}
