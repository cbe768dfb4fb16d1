package cover.transform;

import java.util.*;

import cover.grammar.Grammar;
import cover.grammar.ProductionSet;

import static cover.Config.LOG;
import static cover.util.Utils.join;

/**
 * Builds the covering grammar of a grammar in CNF:
 * cover construction, nullable closure, epsilon elimination, unit closure and unit elimination.
 */
public class CoverPipeline {

	/**
	 * Result of a pipeline run: the final grammar and the input and output of each stage
	 */
	public static class Result {

		public final Grammar base;
		public final Grammar grammar;
		public final List<StageResult> stages;

		Result(Grammar base, Grammar grammar, List<StageResult> stages) {
			this.base = base;
			this.grammar = grammar;
			this.stages = Collections.unmodifiableList(stages);
		}

		/**
		 * @throws NoSuchElementException if no stage of the passed class was run
		 */
		public StageResult stage(Class<? extends Stage> stageClass){
			for (StageResult result : stages) {
				if (stageClass.isInstance(result.stage)){
					return result;
				}
			}
			throw new NoSuchElementException("No stage " + stageClass.getSimpleName());
		}

		/**
		 * Lists the original productions, the productions added by each stage and the final grammar
		 */
		public String report(){
			StringBuilder builder = new StringBuilder();
			builder.append("Original productions:\n").append(base.getProductions()).append("\n");
			for (StageResult stage : stages) {
				builder.append(stage.name).append(":\n");
				if (!stage.added().isEmpty()){
					builder.append(join(stage.added(), "\n")).append("\n");
				}
			}
			builder.append("Final grammar\n").append(grammar.getProductions());
			return builder.toString();
		}
	}

	private final char insertionName;
	private final char insertedTerminalName;
	private final boolean useConfiguredNames;

	/**
	 * Uses the configured names for the insertion non terminals
	 */
	public CoverPipeline() {
		this.insertionName = 0;
		this.insertedTerminalName = 0;
		this.useConfiguredNames = true;
	}

	public CoverPipeline(char insertionName, char insertedTerminalName) {
		this.insertionName = insertionName;
		this.insertedTerminalName = insertedTerminalName;
		this.useConfiguredNames = false;
	}

	/**
	 * Stages in the order they are applied
	 */
	public List<Stage> stages(Grammar grammar){
		CoverConstructor cover = useConfiguredNames ? new CoverConstructor(grammar.getTerminals())
				: new CoverConstructor(grammar.getTerminals(), insertionName, insertedTerminalName);
		return Arrays.asList(cover, new NullableClosure(), new EpsilonEliminator(), new UnitClosure(),
				new UnitEliminator());
	}

	public Result run(Grammar grammar){
		List<StageResult> results = new ArrayList<>();
		ProductionSet current = grammar.getProductions();
		for (Stage stage : stages(grammar)) {
			ProductionSet next = stage.apply(current);
			results.add(new StageResult(stage, current, next));
			current = next;
		}
		LOG.fine(() -> "Finished covering grammar construction: " + join(results, ", "));
		return new Result(grammar, grammar.withProductions(current), results);
	}

	/**
	 * Convenience method that returns only the covering grammar
	 */
	public static Grammar cover(Grammar grammar){
		return new CoverPipeline().run(grammar).grammar;
	}
}
