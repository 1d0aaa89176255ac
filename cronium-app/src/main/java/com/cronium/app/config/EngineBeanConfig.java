package com.cronium.app.config;

import com.cronium.channel.ChannelNotifier;
import com.cronium.channel.Notifier;
import com.cronium.channel.delivery.DiscordChannel;
import com.cronium.channel.delivery.EmailChannel;
import com.cronium.channel.delivery.SlackChannel;
import com.cronium.channel.template.PlaceholderTemplateRenderer;
import com.cronium.channel.template.TemplateRenderer;
import com.cronium.common.config.ConfigService;
import com.cronium.common.config.CroniumConfig;
import com.cronium.engine.action.ActionValidator;
import com.cronium.engine.action.ConditionalActionDispatcher;
import com.cronium.engine.action.ExecutionCounter;
import com.cronium.engine.dispatch.DispatchCoordinator;
import com.cronium.engine.lifecycle.EventLifecycleService;
import com.cronium.engine.schedule.JobScheduler;
import com.cronium.engine.store.InMemoryStore;
import com.cronium.engine.store.JsonFileStore;
import com.cronium.sandbox.DefaultSandboxRunner;
import com.cronium.sandbox.HttpRequestRunner;
import com.cronium.sandbox.LocalScriptRunner;
import com.cronium.sandbox.RemoteScriptRunner;
import com.cronium.sandbox.SandboxRunner;
import com.cronium.sandbox.SshCliSessionProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Spring configuration for the engine beans.
 */
@Slf4j
@Configuration
public class EngineBeanConfig {

    @Value("${cronium.config.path:~/.cronium/config.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(ConfigService.expandHome(Path.of(configPath)));
    }

    @Bean
    public CroniumConfig croniumConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public InMemoryStore eventStore(CroniumConfig config) {
        CroniumConfig.StoreConfig store = config.getStore();
        if ("file".equalsIgnoreCase(store.getType())) {
            Path path = ConfigService.expandHome(Path.of(store.getPath()));
            log.info("Using file store at {}", path);
            return new JsonFileStore(path);
        }
        log.info("Using in-memory store");
        return new InMemoryStore();
    }

    // ── Sandbox ──

    @Bean
    public SandboxRunner sandboxRunner(CroniumConfig config, InMemoryStore store) {
        CroniumConfig.SandboxConfig sandbox = config.getSandbox();
        return new DefaultSandboxRunner(
                new LocalScriptRunner(sandbox, store),
                new RemoteScriptRunner(new SshCliSessionProvider(sandbox), store),
                new HttpRequestRunner(sandbox));
    }

    // ── Channels ──

    @Bean
    public Notifier notifier() {
        return new ChannelNotifier(new EmailChannel(), new SlackChannel(), new DiscordChannel());
    }

    @Bean
    public TemplateRenderer templateRenderer(JobScheduler scheduler) {
        return new PlaceholderTemplateRenderer(scheduler.getZone());
    }

    // ── Engine ──

    @Bean(destroyMethod = "shutdown")
    public JobScheduler jobScheduler(InMemoryStore store, CroniumConfig config, Clock clock) {
        return new JobScheduler(store, config.getScheduler(), clock);
    }

    @Bean
    public ConditionalActionDispatcher conditionalActionDispatcher(InMemoryStore store, TemplateRenderer renderer,
            Notifier notifier, JobScheduler scheduler, CroniumConfig config) {
        return new ConditionalActionDispatcher(store, store, store, renderer, notifier, scheduler,
                config.getNotifications());
    }

    @Bean
    public ExecutionCounter executionCounter(InMemoryStore store, JobScheduler scheduler, Clock clock) {
        return new ExecutionCounter(store, scheduler, clock);
    }

    @Bean
    public DispatchCoordinator dispatchCoordinator(InMemoryStore store, SandboxRunner runner,
            ConditionalActionDispatcher actions, ExecutionCounter counter, CroniumConfig config, Clock clock,
            JobScheduler scheduler) {
        DispatchCoordinator coordinator = new DispatchCoordinator(store, runner, actions, counter, config, clock);
        scheduler.setDispatcher(coordinator);
        return coordinator;
    }

    @Bean
    public ActionValidator actionValidator(InMemoryStore store, CroniumConfig config) {
        return new ActionValidator(store, store, config.getNotifications());
    }

    @Bean
    public EventLifecycleService eventLifecycleService(InMemoryStore store, JobScheduler scheduler,
            ActionValidator validator, Clock clock) {
        return new EventLifecycleService(store, scheduler, validator, clock);
    }
}
