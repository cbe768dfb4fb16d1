package cover.graph;

import java.util.LinkedHashMap;
import java.util.Map;

import cover.grammar.Grammar;
import cover.grammar.Production;
import cover.grammar.Symbol;
import guru.nidi.graphviz.attribute.*;
import guru.nidi.graphviz.model.*;

import static guru.nidi.graphviz.model.Factory.*;

/**
 * Graphviz view of a grammar: a node per symbol and an edge from the left side of each production to every
 * symbol on its right side. Error productions are dashed and labelled with their distance.
 */
public class GrammarGraph {

	public static final String EPSILON_NODE = "ε";

	private final Grammar grammar;
	private final String name;

	public GrammarGraph(Grammar grammar, String name) {
		this.grammar = grammar;
		this.name = name;
	}

	public MutableGraph toGraph(){
		MutableGraph graph = mutGraph(name).setDirected(true);
		graph.graphAttrs().add(Font.name("Helvetica"));
		Map<String, MutableNode> nodes = new LinkedHashMap<>();
		for (Production production : grammar.getProductions()) {
			MutableNode from = node(graph, nodes, production.left);
			if (production.isEpsilon()){
				from.addLink(link(node(graph, nodes, null), production));
			}
			for (Symbol symbol : production.right) {
				from.addLink(link(node(graph, nodes, symbol), production));
			}
		}
		return graph;
	}

	private MutableNode node(MutableGraph graph, Map<String, MutableNode> nodes, Symbol symbol){
		String id = symbol == null ? EPSILON_NODE : symbol.toString();
		return nodes.computeIfAbsent(id, i -> {
			MutableNode node = mutNode(i);
			if (symbol == null){
				node.add(guru.nidi.graphviz.attribute.Shape.POINT);
			} else if (symbol.isTerminal()){
				node.add(guru.nidi.graphviz.attribute.Shape.BOX);
			}
			graph.add(node);
			return node;
		});
	}

	private Link link(MutableNode target, Production production){
		Link link = to(target);
		if (production.distance > 0){
			link = link.with(Style.DASHED, Label.of(String.valueOf(production.distance)));
		}
		return link;
	}

	/**
	 * @return graph in the dot language
	 */
	public String toDot(){
		return toGraph().toString();
	}
}
