package com.zplat.ipld.entity.enumeration;

import com.zplat.ipld.exception.AppException;
import com.zplat.ipld.exception.ErrorCode;

import java.util.Arrays;
import java.util.Locale;

public enum ResultView {
    DONE("done"),
    FAIL("fail"),
    LAST_IPL("last_ipl");

    private final String code;

    ResultView(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static ResultView fromCode(String code) {
        String normalized = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(v -> v.code.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new AppException(ErrorCode.INVALID_REPORT_VIEW, String.valueOf(code)));
    }
}
