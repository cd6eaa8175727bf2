package com.talent.match.dto.enums;

import com.talent.match.utils.basic.Constant;

import java.util.Locale;

public enum MarketplaceType {
    INSTITUTION,
    ATHLETIC;

    public static MarketplaceType fromValue(String value) {
        return value != null && Constant.ATHLETIC_MARKETPLACE.equals(value.trim().toLowerCase(Locale.ROOT)) ? ATHLETIC : INSTITUTION;
    }
}
