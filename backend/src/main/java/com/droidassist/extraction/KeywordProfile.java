package com.droidassist.extraction;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Context vocabulary for one value kind.
 */
@Value
@Builder
public class KeywordProfile {

    /** Labels that name the value directly, e.g. 剩余话费 */
    @Singular("high")
    List<String> highPriority;

    /** Related labels that make a nearby number more likely */
    @Singular("medium")
    List<String> mediumPriority;

    /** Recharge, promotion and coupon wording around decoy numbers */
    @Singular("negative")
    List<String> negative;

    private static final KeywordProfile CURRENCY = KeywordProfile.builder()
        .high("剩余话费").high("剩余余额").high("话费余额").high("账户余额").high("当前余额")
        .high("可用余额").high("剩余").high("余额").high("可用").high("balance").high("remaining")
        .medium("话费").medium("余量").medium("当前").medium("账户")
        .negative("充值").negative("缴费").negative("交费").negative("套餐").negative("售价")
        .negative("优惠").negative("立即").negative("领取").negative("券").negative("福利")
        .negative("暂不可使用").negative("不可使用").negative("recharge").negative("top up")
        .build();

    private static final KeywordProfile DATA = KeywordProfile.builder()
        .high("剩余流量").high("剩余通用流量").high("可用流量").high("剩余").high("remaining data")
        .medium("流量").medium("通用").medium("余量").medium("本月").medium("当前").medium("data")
        .negative("已用").negative("已使用").negative("超出").negative("充值").negative("套餐")
        .negative("售价").negative("优惠").negative("立即").negative("领取").negative("券")
        .negative("福利").negative("加油包").negative("recharge")
        .build();

    public static KeywordProfile defaultsFor(ValueKind kind) {
        return kind == ValueKind.CURRENCY ? CURRENCY : DATA;
    }

    public Optional<String> firstHigh(String text) {
        return firstMatch(highPriority, text);
    }

    public Optional<String> firstMedium(String text) {
        return firstMatch(mediumPriority, text);
    }

    public List<String> negativesIn(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return negative.stream()
            .filter(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)))
            .toList();
    }

    private static Optional<String> firstMatch(List<String> keywords, String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        return keywords.stream()
            .filter(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)))
            .findFirst();
    }
}
