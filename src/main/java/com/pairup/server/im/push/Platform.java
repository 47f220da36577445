package com.pairup.server.im.push;

import java.util.Locale;

public enum Platform {
    IOS,
    ANDROID;

    /**
     * @return the platform for {@code ios}/{@code android} in any case, {@code null} otherwise
     */
    public static Platform parse(String value) {
        if (value == null) {
            return null;
        }
        switch (value.toLowerCase(Locale.ROOT)) {
            case "ios":
                return IOS;
            case "android":
                return ANDROID;
            default:
                return null;
        }
    }
}
