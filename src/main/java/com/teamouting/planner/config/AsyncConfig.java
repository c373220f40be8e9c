package com.teamouting.planner.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Enables asynchronous delivery of phase change events to listeners, so that a slow or failing
 * notification collaborator never holds the event write lock.
 */
@Configuration
@EnableAsync
public class AsyncConfig {
}
