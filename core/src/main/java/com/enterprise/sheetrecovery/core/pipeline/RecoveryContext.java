package com.enterprise.sheetrecovery.core.pipeline;

import lombok.Value;

@Value
public class RecoveryContext {
    RecoveryRequest request;
    InputRoute route;
    RecoveryObserver observer;
}
