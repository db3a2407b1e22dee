package ai.latex.translator.reference;

import java.util.List;

/**
 * One way of repairing a translated document against its original. Implementations are pure.
 */
interface RepairStrategy {

    RepairOutcome repair(List<String> translated, List<String> original);
}
