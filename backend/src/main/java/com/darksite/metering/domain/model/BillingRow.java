package com.darksite.metering.domain.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One line of the daily metering export.
 *
 * Derived from a snapshot and never stored on its own. {@code sno} is the
 * 1-based position in the export, not a stable identity.
 */
@JsonPropertyOrder({"accountId", "qty", "startDate", "endDate", "meteredItem",
        "appid", "sno", "fqdn", "type", "description", "guid"})
public record BillingRow(
        String accountId,
        BigDecimal qty,
        LocalDate startDate,
        LocalDate endDate,
        String meteredItem,
        String appid,
        int sno,
        String fqdn,
        String type,
        String description,
        String guid
) {}
