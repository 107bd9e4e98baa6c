package com.workflow.cli.ui;

import java.io.PrintWriter;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.jline.terminal.Terminal;
import org.springframework.stereotype.Component;

/**
 * Shows a spinning cursor in the console while a long-running task executes on a
 * background thread.
 */
@Component
public class Spinner {

    private final Terminal terminal;
    private final char[] spinnerChars = new char[]{'|', '/', '-', '\\'};

    public Spinner(Terminal terminal) {
        this.terminal = terminal;
    }

    public <T> T spin(Supplier<T> task) {
        return spin("Processing...", task, () -> { });
    }

    /**
     * Executes a task while animating a spinner next to {@code label}.
     * <p>
     * If the calling thread is interrupted (Ctrl-C in the shell), {@code onInterrupt} is run and
     * the spinner keeps waiting, so a task that honours the request can still hand back its
     * partial result. The interrupt is consumed as that request.
     *
     * @param label       Text shown before the spinner.
     * @param task        The task to execute.
     * @param onInterrupt Called each time the waiting thread is interrupted.
     * @param <T>         The type of the result.
     * @return The result of the task.
     * @throws RuntimeException if the task throws.
     */
    public <T> T spin(String label, Supplier<T> task, Runnable onInterrupt) {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<T> future = executor.submit(task::get);
        PrintWriter writer = terminal.writer();
        int spinnerIndex = 0;

        try {
            while (true) {
                try {
                    T result = future.get(100, TimeUnit.MILLISECONDS);
                    clearSpinnerLine(writer);
                    return result;
                } catch (TimeoutException e) {
                    writer.print("\r\u001B[33m" + label + " " + spinnerChars[spinnerIndex++ % spinnerChars.length] + "\u001B[0m");
                    writer.flush();
                } catch (InterruptedException e) {
                    writer.print("\r\u001B[33mStopping after the current step...\u001B[0m");
                    writer.flush();
                    onInterrupt.run();
                }
            }
        } catch (ExecutionException e) {
            clearSpinnerLine(writer);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new RuntimeException(cause);
        } finally {
            executor.shutdown();
        }
    }

    private void clearSpinnerLine(PrintWriter writer) {
        writer.print("\r" + " ".repeat(40) + "\r");
        writer.flush();
    }
}
