package com.cronium.app.api;

import com.cronium.engine.dispatch.DispatchOutcome;
import com.cronium.engine.lifecycle.EventLifecycleService;
import com.cronium.engine.model.Event;
import com.cronium.engine.model.ExecutionLog;
import com.cronium.engine.schedule.JobScheduler;
import com.cronium.engine.schedule.RecurrenceRuleBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST surface over event lifecycle, manual runs and schedule previews.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class EventController {

    private final EventLifecycleService events;
    private final JobScheduler scheduler;

    public EventController(EventLifecycleService events, JobScheduler scheduler) {
        this.events = events;
        this.scheduler = scheduler;
    }

    @GetMapping("/events")
    public List<Event> list() {
        return events.list();
    }

    @GetMapping("/events/{id}")
    public Event get(@PathVariable("id") long id) {
        return events.get(id);
    }

    @PostMapping("/events")
    public ResponseEntity<Event> create(@RequestBody Event event) {
        return ResponseEntity.status(HttpStatus.CREATED).body(events.create(event));
    }

    @PutMapping("/events/{id}")
    public Event update(@PathVariable("id") long id, @RequestBody Event changes) {
        return events.update(id, changes);
    }

    @DeleteMapping("/events/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") long id) {
        events.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/events/{id}/activate")
    public Event activate(@PathVariable("id") long id,
            @RequestParam(name = "resetCounter", defaultValue = "false") boolean resetCounter) {
        return events.activate(id, resetCounter);
    }

    @PostMapping("/events/{id}/reset-counter")
    public Event resetCounter(@PathVariable("id") long id) {
        return events.resetCounter(id);
    }

    @PostMapping("/events/{id}/pause")
    public Event pause(@PathVariable("id") long id) {
        return events.pause(id);
    }

    /**
     * Runs the event synchronously. Answers 409 while another run of the
     * same event is in flight.
     */
    @PostMapping("/events/{id}/run")
    public ResponseEntity<?> run(@PathVariable("id") long id,
            @RequestBody(required = false) Map<String, Object> input) {
        Optional<DispatchOutcome> outcome = events.runNow(id, input != null ? input : Map.of());
        if (outcome.isEmpty()) {
            log.info("Manual run of event {} rejected, already executing", id);
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Event " + id + " is already executing"));
        }
        return ResponseEntity.ok(outcome.get());
    }

    @GetMapping("/events/{id}/logs")
    public List<ExecutionLog> logs(@PathVariable("id") long id,
            @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return events.logs(id, limit);
    }

    @GetMapping("/schedules/validate")
    public Map<String, Object> validate(@RequestParam("expression") String expression) {
        RecurrenceRuleBuilder.CronValidation result =
                RecurrenceRuleBuilder.validateCron(expression, ZonedDateTime.now(scheduler.getZone()));
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("valid", result.valid());
        if (result.error() != null)
            body.put("error", result.error());
        body.put("nextRuns", result.nextRuns().stream().map(ZonedDateTime::toString).toList());
        return body;
    }
}
