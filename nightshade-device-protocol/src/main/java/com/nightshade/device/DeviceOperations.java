package com.nightshade.device;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Hardware abstraction used by the execution engine. Every operation is dispatched without blocking
 * and returns a future; the engine waits on it while polling for cancellation, pause and triggers,
 * and calls {@link CompletableFuture#cancel(boolean)} to abort. Implementations should stop the
 * physical operation when their future is cancelled.
 */
public interface DeviceOperations {

    CompletableFuture<Void> slew(double raHours, double decDegrees);

    /** Plate-solve and re-slew until within {@code accuracyArcsec}. */
    CompletableFuture<Void> center(double raHours, double decDegrees, double accuracyArcsec, int maxAttempts);

    CompletableFuture<FrameResult> expose(FrameRequest request);

    CompletableFuture<FocusResult> autofocus(FocusRequest request, OperationProgress progress);

    CompletableFuture<Void> dither(double pixels, double settlePixels, double settleTimeSecs);

    CompletableFuture<Void> startGuiding(double settlePixels, double settleTimeSecs, boolean autoSelectStar);

    CompletableFuture<Void> stopGuiding();

    CompletableFuture<Void> changeFilter(String filterName, Integer filterPosition);

    CompletableFuture<Void> coolCamera(double targetTempCelsius, double durationMins, OperationProgress progress);

    CompletableFuture<Void> warmCamera(double ratePerMin, OperationProgress progress);

    CompletableFuture<Void> moveRotator(double angleDegrees, boolean relative);

    CompletableFuture<Void> park();

    CompletableFuture<Void> unpark();

    CompletableFuture<Void> meridianFlip(boolean pauseGuiding, boolean autoCenter, double settleTimeSecs);

    CompletableFuture<Void> openDome(boolean shutterOnly);

    CompletableFuture<Void> closeDome(boolean shutterOnly);

    CompletableFuture<Void> parkDome();

    CompletableFuture<Void> polarAlign(PolarAlignmentRequest request, OperationProgress progress);

    /** Forwards a notification to the delivery channel; delivery itself happens elsewhere. */
    CompletableFuture<Void> notify(String title, String message, String level);

    /** Runs an external script and completes with its exit code. */
    CompletableFuture<Integer> runScript(String scriptPath, List<String> arguments);
}
