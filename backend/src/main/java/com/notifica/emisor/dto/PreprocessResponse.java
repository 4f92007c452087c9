package com.notifica.emisor.dto;

import java.util.List;

public record PreprocessResponse(int totalInputRecords,
                                 int totalUniqueAccounts,
                                 int matchedAccounts,
                                 List<String> unmatchedAccounts,
                                 List<String> extraColumns) {
}
