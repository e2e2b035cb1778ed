package com.traceharvest.model;

import lombok.Value;

@Value
public class KeyValue {
    String key;
    String value;
}
