package com.rankfusion.memory.store;

import java.util.List;

public record JsonlReadResult<T>(List<T> rows, int skippedLines) {
}
