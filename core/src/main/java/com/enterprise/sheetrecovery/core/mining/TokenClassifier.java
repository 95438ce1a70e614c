package com.enterprise.sheetrecovery.core.mining;

import lombok.Value;

import java.util.regex.Pattern;

/**
 * Labels a mined token with a coarse type and a short description of what it probably is.
 */
public class TokenClassifier {

    @Value
    public static class Classification {
        String type;
        String description;
    }

    private static final Pattern KOREAN = Pattern.compile("^[가-힣]+$");
    private static final Pattern ENGLISH = Pattern.compile("^[A-Za-z]+$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    public Classification classify(String token) {
        if (KOREAN.matcher(token).matches()) {
            return new Classification("한글", describeKorean(token));
        }
        if (ENGLISH.matcher(token).matches()) {
            return new Classification("영문", "업무 키워드");
        }
        if (DIGITS.matcher(token).matches()) {
            return new Classification("숫자", describeNumber(token));
        }
        return new Classification("복합", "전화번호/주소 등");
    }

    private static String describeKorean(String token) {
        if (token.contains("주문") || token.contains("번호")) {
            return "주문 관련";
        }
        if (token.contains("배송") || token.contains("택배")) {
            return "배송 관련";
        }
        if (token.contains("연락") || token.contains("전화")) {
            return "연락처 관련";
        }
        return "한글 텍스트";
    }

    private static String describeNumber(String token) {
        if (token.length() >= 8) {
            return "주문번호/ID";
        }
        if (token.length() == 5) {
            return "우편번호";
        }
        return "기타 숫자";
    }
}
