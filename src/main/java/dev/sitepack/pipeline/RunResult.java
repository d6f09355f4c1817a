package dev.sitepack.pipeline;

import dev.sitepack.synthesis.DegradedSignal;
import dev.sitepack.synthesis.IntelligencePack;
import java.nio.file.Path;

public record RunResult(Path artifactDirectory, IntelligencePack pack, DegradedSignal degraded) {}
