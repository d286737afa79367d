package com.droidassist.call;

import lombok.Value;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Who is calling, as far as the telephony registry tells.
 */
@Value
public class CallerInfo {

    public static final String UNKNOWN_NUMBER = "unknown";
    public static final String UNKNOWN_NAME = "unknown";

    private static final Pattern INCOMING_NUMBER = Pattern.compile("mCallIncomingNumber=([^\\s,]*)");

    String phoneNumber;
    String callerName;

    public static CallerInfo unknown() {
        return new CallerInfo(UNKNOWN_NUMBER, UNKNOWN_NAME);
    }

    /**
     * Reads the first non-empty mCallIncomingNumber from a registry dump.
     */
    public static CallerInfo fromRegistryDump(String dump) {
        if (dump == null) {
            return unknown();
        }
        Matcher m = INCOMING_NUMBER.matcher(dump);
        while (m.find()) {
            if (!m.group(1).isBlank()) {
                return new CallerInfo(m.group(1), UNKNOWN_NAME);
            }
        }
        return unknown();
    }
}
