package com.taskledger.core.model;

import java.math.BigDecimal;

public record BatchStats(int total, int completed, int failed, BigDecimal successRate) {
}
