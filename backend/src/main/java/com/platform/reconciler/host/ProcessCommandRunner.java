package com.platform.reconciler.host;

import com.platform.reconciler.error.CommandExecutionException;
import com.platform.reconciler.error.CommandTimeoutException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 * Output streams are drained on a separate pool so a chatty process cannot stall on a full pipe.
 */
@Slf4j
@Component
public class ProcessCommandRunner implements CommandRunner {
    
    private static final long OUTPUT_DRAIN_SECONDS = 5;
    
    private final ExecutorService streamReaders;
    
    public ProcessCommandRunner() {
        AtomicInteger counter = new AtomicInteger();
        this.streamReaders = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "process-output-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
    
    @Override
    public CommandResult run(List<String> command, Duration timeout) {
        long startTime = System.currentTimeMillis();
        log.debug("Executing: {}", String.join(" ", command));
        
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new CommandExecutionException(command, e.getMessage(), e);
        }
        
        CompletableFuture<String> stdout = drain(process.getInputStream());
        CompletableFuture<String> stderr = drain(process.getErrorStream());
        
        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                log.warn("Command timed out after {}ms: {}", timeout.toMillis(), String.join(" ", command));
                throw new CommandTimeoutException(command, timeout);
            }
            
            CommandResult result = new CommandResult(
                process.exitValue(),
                stdout.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS),
                stderr.get(OUTPUT_DRAIN_SECONDS, TimeUnit.SECONDS)
            );
            
            log.debug("Command finished with exit code {} in {}ms", 
                result.exitCode(), System.currentTimeMillis() - startTime);
            return result;
            
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new CommandExecutionException(command, "interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new CommandExecutionException(command, "could not read process output", e);
        }
    }
    
    private CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamReaders);
    }
    
    @PreDestroy
    public void shutdown() {
        streamReaders.shutdownNow();
    }
}
