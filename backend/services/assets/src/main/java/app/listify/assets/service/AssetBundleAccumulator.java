package app.listify.assets.service;

import app.listify.assets.domain.AssetBundle;
import app.listify.assets.domain.ConversionOutcome;
import app.listify.assets.domain.type.AssetFormat;
import app.listify.assets.domain.type.AssetStatus;
import app.listify.assets.support.ErrorMessages;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Collects what a pipeline run has produced so far, so the bundle returned on any exit path
 * carries every artifact that already exists on disk.
 */
final class AssetBundleAccumulator {

    private final long startedNanos;
    private final Set<AssetFormat> formats = EnumSet.noneOf(AssetFormat.class);
    private final List<String> notes = new ArrayList<>();
    private Path preprocessedImage;
    private Path model;
    private Path video;
    private Path ar;
    private List<String> previewRenderUrls = List.of();
    private List<String> previewRenderPaths = List.of();

    AssetBundleAccumulator(long startedNanos) {
        this.startedNanos = startedNanos;
    }

    AssetBundleAccumulator preprocessedImage(Path path) {
        this.preprocessedImage = path;
        return this;
    }

    AssetBundleAccumulator previewRenders(List<String> urls) {
        this.previewRenderUrls = urls == null ? List.of() : List.copyOf(urls);
        return this;
    }

    AssetBundleAccumulator previewPaths(List<Path> paths) {
        List<String> values = new ArrayList<>();
        if (paths != null) {
            for (Path path : paths) {
                values.add(path.toString());
            }
        }
        this.previewRenderPaths = List.copyOf(values);
        return this;
    }

    AssetBundleAccumulator model(Path path) {
        this.model = path;
        formats.add(AssetFormat.model);
        return this;
    }

    AssetBundleAccumulator video(ConversionOutcome outcome) {
        if (outcome.succeeded()) {
            this.video = outcome.path();
            formats.add(AssetFormat.video);
        } else {
            notes.add("Video unavailable: " + outcome.failureReason());
        }
        return this;
    }

    AssetBundleAccumulator ar(ConversionOutcome outcome) {
        if (outcome.succeeded()) {
            this.ar = outcome.path();
            formats.add(AssetFormat.ar);
        } else {
            notes.add("AR model unavailable: " + outcome.failureReason());
        }
        return this;
    }

    AssetBundle completed() {
        String message = notes.isEmpty() ? null : String.join("; ", notes);
        return build(AssetStatus.completed, message, null);
    }

    AssetBundle skipped(String message) {
        return build(AssetStatus.skipped, message, null);
    }

    AssetBundle error(Throwable failure) {
        String detail = ErrorMessages.summarize(failure);
        return build(AssetStatus.error, "3D asset generation failed: " + detail, detail);
    }

    double elapsedSeconds(long nowNanos) {
        double seconds = (nowNanos - startedNanos) / 1_000_000_000.0;
        return Math.round(Math.max(seconds, 0) * 100.0) / 100.0;
    }

    private AssetBundle build(AssetStatus status, String message, String errorDetail) {
        return new AssetBundle(
                pathString(model),
                pathString(video),
                pathString(ar),
                previewRenderUrls,
                previewRenderPaths,
                pathString(preprocessedImage),
                status,
                status == AssetStatus.completed ? formats : EnumSet.noneOf(AssetFormat.class),
                elapsedSeconds(System.nanoTime()),
                message,
                errorDetail
        );
    }

    private static String pathString(Path path) {
        return path == null ? null : path.toString();
    }
}
