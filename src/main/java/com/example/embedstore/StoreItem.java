package com.example.embedstore;

import lombok.Value;

@Value
public class StoreItem {
    String key;
    String text;
}
