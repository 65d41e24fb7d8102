package com.example.identity.service;

import com.example.identity.model.AccountRecord;
import java.util.List;

public record AccountPage(List<AccountRecord> items, long total, int offset, int limit) {

  public AccountPage {
    items = List.copyOf(items);
  }
}
