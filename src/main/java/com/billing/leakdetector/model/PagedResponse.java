package com.billing.leakdetector.model;

import java.util.List;

public record PagedResponse<T>(List<T> data, long total, int offset, int limit, boolean hasMore) {}
