package cover;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import cover.graph.GrammarGraph;
import cover.grammar.Grammar;
import cover.grammar.GrammarBuilder;
import cover.transform.CoverPipeline;

/**
 * Prints the construction of a covering grammar stage by stage.
 *
 * Usage: <code>[-t TERMINALS] [--dot FILE] [PRODUCTION...]</code>, without productions the a^n b^n example
 * grammar is used.
 */
public class Main {

	public static final String[] EXAMPLE = {"S->AC", "S->AB", "C->SB", "A->a", "B->b"};

	public static void main(String[] args) throws IOException {
		GrammarBuilder builder = new GrammarBuilder();
		String dotFile = null;
		boolean hasProductions = false;
		boolean hasTerminals = false;
		for (int i = 0; i < args.length; i++){
			switch (args[i]){
				case "-t":
					builder.terminals(argument(args, ++i, "-t"));
					hasTerminals = true;
					break;
				case "--dot":
					dotFile = argument(args, ++i, "--dot");
					break;
				default:
					builder.addAll(args[i]);
					hasProductions = true;
			}
		}
		if (!hasProductions){
			builder.add(EXAMPLE);
			if (!hasTerminals){
				builder.terminals("ab");
			}
		}
		Grammar grammar = builder.toGrammar();
		CoverPipeline.Result result = new CoverPipeline().run(grammar);
		System.out.println(result.report());
		if (dotFile != null){
			String dot = new GrammarGraph(result.grammar, "cover").toDot();
			Files.write(Paths.get(dotFile), dot.getBytes(StandardCharsets.UTF_8));
		}
	}

	private static String argument(String[] args, int index, String option){
		if (index >= args.length){
			throw new CoverException(String.format("Option %s needs an argument", option));
		}
		return args[index];
	}
}
