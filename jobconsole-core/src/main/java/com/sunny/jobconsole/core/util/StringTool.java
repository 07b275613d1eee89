package com.sunny.jobconsole.core.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 字符串工具类
 *
 * @author sunny
 * @since 2025-12-08
 */
public class StringTool {

    public static boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }

    public static boolean isNotBlank(String str) {
        return !isBlank(str);
    }

    public static String trim(String str) {
        return str == null ? null : str.trim();
    }

    /**
     * 截断到最大长度
     */
    public static String truncate(String str, int maxLength) {
        if (str == null || str.length() <= maxLength) {
            return str;
        }
        return str.substring(0, maxLength);
    }

    /**
     * 按 "," 与换行拆分，去空白并丢弃空项
     */
    public static List<String> splitList(String raw) {
        List<String> result = new ArrayList<>();
        if (raw == null) {
            return result;
        }
        for (String item : raw.split("[,\\n]")) {
            String value = item.trim();
            if (!value.isEmpty()) {
                result.add(value);
            }
        }
        return result;
    }

    /**
     * 执行器地址规范化：缺少协议时补 http://
     */
    public static String normalizeAddress(String address) {
        if (isBlank(address)) {
            return null;
        }
        String value = address.trim();
        return value.contains("://") ? value : "http://" + value;
    }

    /**
     * 拆分并规范化地址列表，保持顺序去重
     */
    public static List<String> parseAddressList(String raw) {
        Set<String> result = new LinkedHashSet<>();
        for (String item : splitList(raw)) {
            result.add(normalizeAddress(item));
        }
        return new ArrayList<>(result);
    }
}
