package com.sunny.jobconsole.core.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.reflect.TypeToken;
import com.sunny.jobconsole.core.biz.model.ReturnT;

import java.lang.reflect.Type;
import java.util.List;

/**
 * 调度中心与执行器之间报文的 Gson 编解码
 *
 * @author sunny
 * @since 2025-12-08
 */
public class GsonTool {

    // 报文里的 Date 只出现在管理端返回，时间戳一律是毫秒 long
    private static final Gson GSON = new GsonBuilder()
            .setDateFormat("yyyy-MM-dd HH:mm:ss")
            .disableHtmlEscaping()
            .create();

    public static String toJson(Object obj) {
        return GSON.toJson(obj);
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        return GSON.fromJson(json, clazz);
    }

    /**
     * 批量报文，例如执行器回调: fromJsonList(json, HandleCallbackParam.class)
     */
    public static <T> List<T> fromJsonList(String json, Class<T> elementClass) {
        Type type = TypeToken.getParameterized(List.class, elementClass).getType();
        return GSON.fromJson(json, type);
    }

    /**
     * 执行器应答 {code,msg,content}
     */
    public static <T> ReturnT<T> fromReturnT(JsonElement element, Class<T> contentClass) {
        Type type = TypeToken.getParameterized(ReturnT.class, contentClass).getType();
        return GSON.fromJson(element, type);
    }
}
