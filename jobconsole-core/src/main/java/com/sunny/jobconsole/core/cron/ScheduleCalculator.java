package com.sunny.jobconsole.core.cron;

import com.sunny.jobconsole.core.enums.ScheduleTypeEnum;
import com.sunny.jobconsole.core.util.StringTool;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 下次触发时间计算
 * <p>
 * 基于 Spring CronExpression 实现，结果只取决于入参与构造时给定的时区
 * <ul>
 *     <li>NONE：没有下次触发</li>
 *     <li>CRON：6 段表达式 (秒 分 时 日 月 周)，5 段表达式自动补秒位 0</li>
 *     <li>FIXED_RATE / FIXED_DELAY：非负整数秒，next = after + 秒数 * 1000</li>
 * </ul>
 *
 * @author SunnyX6
 * @date 2025-12-13
 */
public class ScheduleCalculator {

    private static final Pattern SECONDS_PATTERN = Pattern.compile("\\d+");

    private final ZoneId zoneId;

    public ScheduleCalculator(ZoneId zoneId) {
        this.zoneId = zoneId == null ? ZoneId.systemDefault() : zoneId;
    }

    public ZoneId getZoneId() {
        return zoneId;
    }

    /**
     * 计算严格晚于 afterMs 的下一次触发时间
     *
     * @param scheduleType 调度类型
     * @param scheduleConf 调度配置 (Cron 或间隔秒数)
     * @param afterMs      起始时间 (毫秒)
     * @return 下一次触发时间 (毫秒)，无下次触发时为 empty
     * @throws InvalidScheduleException     配置无法解析
     * @throws UnsupportedScheduleException 调度类型未知
     */
    public Optional<Long> next(String scheduleType, String scheduleConf, long afterMs) {
        ScheduleTypeEnum type = ScheduleTypeEnum.match(scheduleType);
        if (type == null) {
            throw new UnsupportedScheduleException("unsupported schedule type: %s", scheduleType);
        }
        return switch (type) {
            case NONE -> Optional.empty();
            case CRON -> nextCron(scheduleConf, afterMs);
            case FIXED_RATE, FIXED_DELAY -> Optional.of(nextFixed(scheduleConf, afterMs));
        };
    }

    /**
     * 连续计算 count 次触发时间，遇到无下次触发时提前结束
     */
    public List<Long> nextTimes(String scheduleType, String scheduleConf, long fromMs, int count) {
        List<Long> result = new ArrayList<>();
        long cursor = fromMs;
        for (int i = 0; i < count; i++) {
            Optional<Long> next = next(scheduleType, scheduleConf, cursor);
            if (next.isEmpty()) {
                break;
            }
            cursor = next.get();
            result.add(cursor);
        }
        return result;
    }

    /**
     * 解析 Cron 表达式，兼容 5 段写法
     */
    public static CronExpression parseCron(String cronExpr) {
        if (StringTool.isBlank(cronExpr)) {
            throw new InvalidScheduleException("cron expression is empty");
        }
        String expr = cronExpr.trim();
        if (expr.split("\\s+").length == 5) {
            expr = "0 " + expr;
        }
        try {
            return CronExpression.parse(expr);
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException("invalid cron expression: %s", cronExpr);
        }
    }

    private Optional<Long> nextCron(String cronExpr, long afterMs) {
        CronExpression cron = parseCron(cronExpr);
        ZonedDateTime from = ZonedDateTime.ofInstant(Instant.ofEpochMilli(afterMs), zoneId);
        ZonedDateTime next = cron.next(from);
        if (next == null) {
            return Optional.empty();
        }
        return Optional.of(next.toInstant().toEpochMilli());
    }

    private static long nextFixed(String secondsExpr, long afterMs) {
        String expr = StringTool.trim(secondsExpr);
        if (expr == null || !SECONDS_PATTERN.matcher(expr).matches()) {
            throw new InvalidScheduleException("invalid fixed interval seconds: %s", secondsExpr);
        }
        try {
            long intervalMs = Math.multiplyExact(Long.parseLong(expr), 1000L);
            return Math.addExact(afterMs, intervalMs);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidScheduleException("fixed interval out of range: %s", secondsExpr);
        }
    }
}
