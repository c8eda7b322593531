package com.rankfusion.bandit.store;

import com.rankfusion.bandit.service.ThompsonModel;

public record ArmLoadResult(ThompsonModel model, LoadStatus status, String reason) {
}
