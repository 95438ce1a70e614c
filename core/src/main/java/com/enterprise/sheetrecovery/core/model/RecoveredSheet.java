package com.enterprise.sheetrecovery.core.model;

import lombok.Value;

@Value
public class RecoveredSheet {
    String name;
    Table table;
}
