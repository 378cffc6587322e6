package com.factory.palletizer.dto;

import lombok.Data;

@Data
public class CounterUpdate {
    private Long value;
}
