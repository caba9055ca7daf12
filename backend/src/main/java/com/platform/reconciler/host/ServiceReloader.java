package com.platform.reconciler.host;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Makes running services pick up new configuration, preferring the least disruptive
 * mechanism the service supports.
 */
@Slf4j
@Component
public class ServiceReloader {
    
    private final CommandRunner commandRunner;
    private final HostOperations hostOperations;
    private final Duration reloadTimeout;
    private final Map<String, ReloadStrategy> strategies = new ConcurrentHashMap<>();
    private final Map<String, ReloadResult> lastResults = new ConcurrentHashMap<>();
    
    public ServiceReloader(
            CommandRunner commandRunner,
            HostOperations hostOperations,
            @Value("${reconciler.services.reload-timeout:PT30S}") Duration reloadTimeout) {
        this.commandRunner = commandRunner;
        this.hostOperations = hostOperations;
        this.reloadTimeout = reloadTimeout;
        registerCommonServices();
    }
    
    private void registerCommonServices() {
        // Web servers
        strategies.put("nginx", ReloadStrategy.signal("HUP"));
        strategies.put("apache2", ReloadStrategy.command("apachectl", "graceful"));
        strategies.put("httpd", ReloadStrategy.command("apachectl", "graceful"));
        
        // Mail
        strategies.put("postfix", ReloadStrategy.command("postfix", "reload"));
        strategies.put("dovecot", ReloadStrategy.command("doveadm", "reload"));
        
        // DNS
        strategies.put("bind9", ReloadStrategy.command("rndc", "reload"));
        strategies.put("named", ReloadStrategy.command("rndc", "reload"));
        
        strategies.put("sshd", ReloadStrategy.signal("HUP"));
        strategies.put("rsyslog", ReloadStrategy.signal("HUP"));
        strategies.put("NetworkManager", ReloadStrategy.systemd());
        strategies.put("systemd-resolved", ReloadStrategy.systemd());
        strategies.put("systemd-timesyncd", ReloadStrategy.systemd());
        
        // Display managers cannot reload in place
        strategies.put("gdm", ReloadStrategy.restart());
        strategies.put("sddm", ReloadStrategy.restart());
        strategies.put("lightdm", ReloadStrategy.restart());
    }
    
    /**
     * Override or add the reload strategy for a service.
     */
    public void registerStrategy(String service, ReloadStrategy strategy) {
        strategies.put(service, strategy);
    }
    
    /**
     * Reload a service. A service that is not running is started instead.
     */
    public ReloadResult reload(String service) {
        if (!hostOperations.isServiceActive(service)) {
            log.info("Service {} is not running, starting it", service);
            commandRunner.runChecked(List.of("systemctl", "start", service), reloadTimeout);
            ReloadResult result = ReloadResult.started(service);
            lastResults.put(service, result);
            return result;
        }
        
        ReloadStrategy strategy = strategies.computeIfAbsent(service, this::detectStrategy);
        
        switch (strategy.method()) {
            case SIGNAL -> commandRunner.runChecked(
                List.of("systemctl", "kill", "--kill-who=main", "-s", strategy.command().get(0), service),
                reloadTimeout);
            case COMMAND -> commandRunner.runChecked(strategy.command(), reloadTimeout);
            case SYSTEMD -> commandRunner.runChecked(List.of("systemctl", "reload", service), reloadTimeout);
            case RESTART, START -> commandRunner.runChecked(List.of("systemctl", "restart", service), reloadTimeout);
        }
        
        log.info("Reloaded service {} via {}", service, strategy.method());
        ReloadResult result = ReloadResult.reloaded(service, strategy.method());
        lastResults.put(service, result);
        return result;
    }
    
    /**
     * Reload several services sequentially, in the given order.
     */
    public Map<String, ReloadResult> reloadAll(List<String> services) {
        Map<String, ReloadResult> results = new LinkedHashMap<>();
        for (String service : services) {
            results.put(service, reload(service));
        }
        return results;
    }
    
    public ReloadResult lastResult(String service) {
        return lastResults.get(service);
    }
    
    private ReloadStrategy detectStrategy(String service) {
        CommandResult result = commandRunner.run(List.of("systemctl", "show", "-p", "CanReload", service), reloadTimeout);
        if (result.isSuccess() && result.stdout().contains("CanReload=yes")) {
            return ReloadStrategy.systemd();
        }
        return ReloadStrategy.restart();
    }
}
