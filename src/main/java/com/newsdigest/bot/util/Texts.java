package com.newsdigest.bot.util;

/**
 * 문자열 자르기.
 *
 * 이모지 같은 보충 문자는 UTF-16 두 글자(서로게이트 쌍)라서 그 사이에서 자르면
 * 깨진 글자가 남고 Telegram은 메시지를 거부합니다. 자르는 위치가 쌍의 가운데면 한 글자 앞에서 자릅니다.
 */
public final class Texts {

    private Texts() {
    }

    /**
     * @return maxLength 이하의 앞부분. null은 그대로 반환
     */
    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text;
        }
        int end = Math.max(maxLength, 0);
        if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
