package com.notifica.emisor.dto;

/** A problem tied to one CSV record; {@code printOrder} is null when the record never got that far. */
public record RecordError(String account, Integer printOrder, String message) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (account != null) sb.append("account=").append(account).append(' ');
        if (printOrder != null) sb.append("print_order=").append(printOrder).append(' ');
        return sb.append(message).toString();
    }
}
