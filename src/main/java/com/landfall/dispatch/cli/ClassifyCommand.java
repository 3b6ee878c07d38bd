package com.landfall.dispatch.cli;

import com.landfall.stability.StabilityClassifier;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;

/**
 * CLI command: landfall classify &lt;Kind&gt;...
 * <p>
 * Prints the stability check a deploy would run for each kind. Pure, no cluster access.
 */
@Command(name = "classify", mixinStandardHelpOptions = true,
        description = "Show the stability check used for resource kinds")
@Component
public class ClassifyCommand implements Runnable {

    @Parameters(arity = "0..*", description = "Resource kinds, e.g. Deployment Pod Job")
    List<String> kinds = new ArrayList<>();

    private final StabilityClassifier classifier;

    public ClassifyCommand(StabilityClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public void run() {
        var targets = kinds.isEmpty() ? classifier.registeredKinds().keySet().stream().sorted().toList() : kinds;
        for (var kind : targets) {
            ConsoleOutput.classification(kind, classifier.strategyFor(kind).name());
        }
    }
}
