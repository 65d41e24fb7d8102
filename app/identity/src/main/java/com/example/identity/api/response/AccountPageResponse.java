package com.example.identity.api.response;

import com.example.identity.service.AccountPage;
import java.util.List;

public record AccountPageResponse(List<AccountResponse> items, long total, int offset, int limit) {

    public static AccountPageResponse from(AccountPage page) {
        return new AccountPageResponse(
                page.items().stream().map(AccountResponse::from).toList(),
                page.total(),
                page.offset(),
                page.limit());
    }
}
