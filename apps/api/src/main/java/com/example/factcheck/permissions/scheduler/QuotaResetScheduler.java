package com.example.factcheck.permissions.scheduler;

import com.example.factcheck.config.properties.PermissionsProperties;
import com.example.factcheck.permissions.service.UserPermissionsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.scheduling.annotation.SchedulingConfigurer;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.ZoneId;

/**
 * Starts a new quota period once a day, on the schedule of {@code app.permissions.reset}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuotaResetScheduler implements SchedulingConfigurer {

    private final UserPermissionsService permissionsService;
    private final PermissionsProperties properties;

    @Override
    public void configureTasks(@NonNull ScheduledTaskRegistrar taskRegistrar) {
        PermissionsProperties.Reset reset = properties.reset();
        if (!reset.enabled()) {
            log.info("Daily quota reset disabled");
            return;
        }
        taskRegistrar.addCronTask(new CronTask(this::resetDailyQuotas,
                new CronTrigger(reset.cron(), ZoneId.of(reset.zone()))));
        log.info("Daily quota reset scheduled (cron='{}', zone={})", reset.cron(), reset.zone());
    }

    public void resetDailyQuotas() {
        log.debug("Daily quota reset triggered");
        permissionsService.reset();
    }
}
