package com.umitunal.taskq.cron;

/**
 * Common cron expressions.
 */
public final class CronPatterns {
    public static final String EVERY_MINUTE = "* * * * *";
    public static final String EVERY_5_MINUTES = "*/5 * * * *";
    public static final String EVERY_15_MINUTES = "*/15 * * * *";
    public static final String EVERY_30_MINUTES = "*/30 * * * *";
    public static final String EVERY_HOUR = "0 * * * *";
    public static final String EVERY_2_HOURS = "0 */2 * * *";
    public static final String EVERY_6_HOURS = "0 */6 * * *";
    public static final String DAILY = "0 0 * * *";
    public static final String DAILY_3AM = "0 3 * * *";
    /** Sundays at midnight */
    public static final String WEEKLY = "0 0 * * 0";
    /** The 1st of every month at midnight */
    public static final String MONTHLY = "0 0 1 * *";
    /** On the hour, 9 AM to 5 PM, Monday to Friday */
    public static final String BUSINESS_HOURS = "0 9-17 * * 1-5";
    public static final String WEEKDAYS_9AM = "0 9 * * 1-5";

    private CronPatterns() {
    }
}
