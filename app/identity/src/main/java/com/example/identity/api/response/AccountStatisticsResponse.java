package com.example.identity.api.response;

import com.example.identity.model.AccountStatistics;

public record AccountStatisticsResponse(
        long total,
        long pending,
        long active,
        long inactive,
        long suspended,
        long deleted,
        long admins,
        long verified,
        long unverified) {

    public static AccountStatisticsResponse from(AccountStatistics statistics) {
        return new AccountStatisticsResponse(
                statistics.total(),
                statistics.pending(),
                statistics.active(),
                statistics.inactive(),
                statistics.suspended(),
                statistics.deleted(),
                statistics.admins(),
                statistics.verified(),
                statistics.unverified());
    }
}
