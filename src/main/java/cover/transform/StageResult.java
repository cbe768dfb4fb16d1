package cover.transform;

import java.util.List;

import cover.grammar.Production;
import cover.grammar.ProductionSet;

/**
 * Input and output of a single stage
 */
public class StageResult {

	public final Stage stage;
	public final String name;
	public final ProductionSet input;
	public final ProductionSet output;

	public StageResult(Stage stage, ProductionSet input, ProductionSet output) {
		this.stage = stage;
		this.name = stage.name();
		this.input = input;
		this.output = output;
	}

	/**
	 * Productions of the output that aren't part of the input, includes productions whose distance decreased
	 */
	public List<Production> added(){
		return output.difference(input);
	}

	/**
	 * Productions of the input that aren't part of the output
	 */
	public List<Production> removed(){
		return input.difference(output);
	}

	@Override
	public String toString() {
		return String.format("%s (+%d, -%d)", name, added().size(), removed().size());
	}
}
