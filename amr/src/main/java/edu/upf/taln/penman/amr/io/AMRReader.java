package edu.upf.taln.penman.amr.io;

import com.google.common.base.Stopwatch;
import edu.upf.taln.penman.amr.AMRModel;
import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.transform.Transformations;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads AMR banks: graphs separated by blank lines, each optionally preceded by "# ::key value" comment lines.
 */
public class AMRReader
{
	public final static String ID_KEY = "id";
	private final boolean dereify_edges; // If true -> collapse reified relations such as have-mod-91 into edges
	private final PenmanCodec codec = new PenmanCodec(AMRModel.get());
	private final static Logger log = LogManager.getLogger();

	public AMRReader() { dereify_edges = false; }
	public AMRReader(boolean dereify_edges)
	{
		this.dereify_edges = dereify_edges;
	}

	/**
	 * Graphs that cannot be decoded are logged and skipped. Graphs without an id get the index of their block.
	 */
	public List<Graph> read(String amrBank)
	{
		log.info("Reading AMR graphs");
		Stopwatch timer = Stopwatch.createStarted();
		List<Graph> graphs = new ArrayList<>();

		String[] graphs_text = amrBank.split("\\r?\\n\\s*\\r?\\n");
		for (int i = 0; i < graphs_text.length; ++i)
		{
			String text = graphs_text[i].strip();
			String[] lines = text.split("\\r?\\n");
			if (text.isEmpty() || Arrays.stream(lines).allMatch(l -> l.strip().startsWith("#")))
				continue;

			try
			{
				Graph graph = codec.decode(text);
				if (StringUtils.isBlank(graph.getMetadata().get(ID_KEY)))
					graph.getMetadata().put(ID_KEY, Integer.toString(i));
				if (dereify_edges)
					graph = Transformations.dereifyEdges(graph, codec.getModel());
				graphs.add(graph);
			}
			catch (PenmanException e)
			{
				log.error("Failed to read graph " + i + ": " + e);
			}
		}

		log.info(graphs.size() + " graphs read in " + timer.stop());
		return graphs;
	}
}
