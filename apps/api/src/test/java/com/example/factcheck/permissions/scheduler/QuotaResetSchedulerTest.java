package com.example.factcheck.permissions.scheduler;

import com.example.factcheck.config.properties.PermissionsProperties;
import com.example.factcheck.permissions.service.UserPermissionsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.config.CronTask;
import org.springframework.scheduling.config.ScheduledTaskRegistrar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuotaResetScheduler")
class QuotaResetSchedulerTest {

    @Mock
    private UserPermissionsService permissionsService;

    private QuotaResetScheduler scheduler(PermissionsProperties.Reset reset) {
        return new QuotaResetScheduler(permissionsService, new PermissionsProperties(null, reset));
    }

    @Test
    @DisplayName("should reset quotas when triggered")
    void shouldResetQuotas() {
        scheduler(null).resetDailyQuotas();

        verify(permissionsService).reset();
        verifyNoMoreInteractions(permissionsService);
    }

    @Test
    @DisplayName("should register a midnight cron by default")
    void shouldRegisterDefaultCron() {
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        scheduler(null).configureTasks(registrar);

        assertThat(registrar.getCronTaskList())
                .singleElement()
                .extracting(CronTask::getExpression)
                .isEqualTo("0 0 0 * * *");
    }

    @Test
    @DisplayName("should use the configured cron expression")
    void shouldUseConfiguredCron() {
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        scheduler(new PermissionsProperties.Reset(true, "0 30 3 * * *", "Europe/Paris")).configureTasks(registrar);

        assertThat(registrar.getCronTaskList())
                .singleElement()
                .extracting(CronTask::getExpression)
                .isEqualTo("0 30 3 * * *");
    }

    @Test
    @DisplayName("should run the reset from the registered task")
    void shouldRunResetFromTask() {
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();
        scheduler(null).configureTasks(registrar);

        registrar.getCronTaskList().get(0).getRunnable().run();

        verify(permissionsService).reset();
    }

    @Test
    @DisplayName("should register nothing when disabled")
    void shouldRegisterNothingWhenDisabled() {
        ScheduledTaskRegistrar registrar = new ScheduledTaskRegistrar();

        scheduler(new PermissionsProperties.Reset(false, null, null)).configureTasks(registrar);

        assertThat(registrar.getCronTaskList()).isEmpty();
        verifyNoInteractions(permissionsService);
    }
}
