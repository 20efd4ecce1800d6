package com.umitunal;

import com.umitunal.examples.BasicExample;
import com.umitunal.examples.CronScheduleExample;
import com.umitunal.examples.RetryExample;

/**
 * Main class that runs all taskq examples.
 */
public class Main {
    public static void main(String[] args) throws Exception {
        System.out.println("=== taskq Examples ===\n");

        BasicExample.main(args);
        RetryExample.main(args);
        CronScheduleExample.main(args);

        System.out.println("\n=== All Examples Complete ===");
    }
}
