package com.example.embedstore;

import lombok.Value;

@Value
public class Candidate {
    String key;
    double value;
}
