package edu.upf.taln.penman.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.base.Stopwatch;
import edu.upf.taln.penman.core.Options;
import edu.upf.taln.penman.core.Penman;
import edu.upf.taln.penman.core.PenmanCodec;
import edu.upf.taln.penman.core.PenmanException;
import edu.upf.taln.penman.core.model.Model;
import edu.upf.taln.penman.core.structures.Graph;
import edu.upf.taln.penman.core.structures.Tree;
import edu.upf.taln.penman.core.structures.Triple;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.*;

import static java.util.stream.Collectors.joining;

public class Driver
{
	public final static int OK = 0;
	public final static int FAILED = 1;
	public final static int USAGE = 2;

	private final static Logger log = LogManager.getLogger();
	private static final String process_command = "process";
	private static final String check_command = "check";

	private final PenmanProperties properties;

	public Driver(PenmanProperties properties)
	{
		this.properties = properties;
	}

	/**
	 * Reads all graphs in a file and writes them back normalized as the options say, to a file or to standard output.
	 */
	private int process(Path input_file, Path output_file, Model model, Options options)
	{
		log.info("Running from " + input_file);
		log.debug(options);
		Stopwatch timer = Stopwatch.createStarted();
		String text = FileUtils.readTextFile(input_file);
		if (text == null)
			return FAILED;

		List<Tree> trees;
		try
		{
			trees = new PenmanCodec(model).parseAll(text);
		}
		catch (PenmanException e)
		{
			log.error("Cannot parse " + input_file + ": " + e.getMessage());
			return FAILED;
		}

		List<String> results = new ArrayList<>();
		int num_failed = 0;
		for (int i = 0; i < trees.size(); ++i)
		{
			try
			{
				results.add(Penman.process(trees.get(i), model, options));
			}
			catch (PenmanException e)
			{
				log.error("Cannot process graph " + i + ": " + e.getMessage());
				++num_failed;
			}
		}

		String out = String.join("\n\n", results) + "\n";
		if (output_file == null)
			System.out.print(out);
		else if (FileUtils.writeTextToFile(output_file, out))
			log.info("Graphs written to " + output_file);
		else
			return FAILED;

		log.info("Processed " + results.size() + " graphs out of " + trees.size() + " in " + timer.stop());
		return num_failed == 0 ? OK : FAILED;
	}

	/**
	 * Logs the errors found by the model in each graph of a file.
	 */
	private int check(Path input_file, Model model)
	{
		log.info("Checking " + input_file);
		String text = FileUtils.readTextFile(input_file);
		if (text == null)
			return FAILED;

		List<Graph> graphs;
		try
		{
			graphs = Penman.loads(text, model);
		}
		catch (PenmanException e)
		{
			log.error("Cannot parse " + input_file + ": " + e.getMessage());
			return FAILED;
		}

		int num_invalid = 0;
		for (int i = 0; i < graphs.size(); ++i)
		{
			Graph g = graphs.get(i);
			String id = g.getMetadata().getOrDefault("id", Integer.toString(i));
			Map<Triple, List<String>> errors = model.errors(g);
			if (!errors.isEmpty())
				++num_invalid;
			errors.forEach((triple, messages) -> messages.forEach(m ->
					log.error("Graph " + id + ": " + (triple == null ? "" : triple + " ") + m)));
		}

		log.info(num_invalid + " invalid graphs out of " + graphs.size());
		return num_invalid == 0 ? OK : FAILED;
	}

	private Options createOptions(ProcessCommand command)
	{
		Options options = new Options();
		options.indent = command.indent != null ? CMLCheckers.toIndent(command.indent) : properties.getIndent();
		options.compact = command.compact || properties.isCompact();
		options.triples = command.triples;
		options.canonicalize_roles = command.canonicalize_roles;
		options.reify_edges = command.reify_edges;
		options.dereify_edges = command.dereify_edges;
		options.reify_attributes = command.reify_attributes;
		options.indicate_branches = command.indicate_branches;
		options.make_variables = command.make_variables;
		options.rearrange = command.rearrange;
		options.attributes_first = command.attributes_first;
		return options;
	}

	@Parameters(commandDescription = "Read PENMAN graphs and write them normalized")
	private static class ProcessCommand
	{
		@Parameter(names = {"-i", "--input"}, description = "Input PENMAN file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path inputFile;
		@Parameter(names = {"-o", "--output"}, description = "Output file, standard output if missing", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		private Path outputFile = null;
		@Parameter(names = {"-m", "--model"}, description = "Model: default, amr, noop or path to a JSON model", arity = 1,
				validateWith = CMLCheckers.ModelValidator.class)
		private String model = null;
		@Parameter(names = "--indent", description = "Indentation: flat, adaptive or number of columns", arity = 1,
				validateWith = CMLCheckers.IndentValidator.class)
		private String indent = null;
		@Parameter(names = "--compact", description = "Keep attributes before the first nested node on the first line")
		private boolean compact = false;
		@Parameter(names = "--triples", description = "Write conjunctions of triples instead of trees")
		private boolean triples = false;
		@Parameter(names = "--canonicalize-roles", description = "Normalize roles")
		private boolean canonicalize_roles = false;
		@Parameter(names = "--reify-edges", description = "Replace edges with reified nodes")
		private boolean reify_edges = false;
		@Parameter(names = "--dereify-edges", description = "Collapse reified nodes into edges")
		private boolean dereify_edges = false;
		@Parameter(names = "--reify-attributes", description = "Make nodes out of attribute values")
		private boolean reify_attributes = false;
		@Parameter(names = "--indicate-branches", description = "Add top-role triples for each branch")
		private boolean indicate_branches = false;
		@Parameter(names = "--make-variables", description = "Rename variables with a format such as {prefix}{j}", arity = 1)
		private String make_variables = null;
		@Parameter(names = "--rearrange", description = "Order of branches: canonical or random", arity = 1,
				converter = CMLCheckers.RearrangementConverter.class, validateWith = CMLCheckers.RearrangementValidator.class)
		private Options.Rearrangement rearrange = Options.Rearrangement.NONE;
		@Parameter(names = "--attributes-first", description = "Place attributes before edges")
		private boolean attributes_first = false;
	}

	@Parameters(commandDescription = "Check PENMAN graphs against a model")
	private static class CheckCommand
	{
		@Parameter(names = {"-i", "--input"}, description = "Input PENMAN file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		private Path inputFile;
		@Parameter(names = {"-m", "--model"}, description = "Model: default, amr, noop or path to a JSON model", arity = 1,
				validateWith = CMLCheckers.ModelValidator.class)
		private String model = null;
	}

	/**
	 * @return exit status: {@link #OK}, {@link #FAILED} if some graph could not be read, processed or checked, or
	 * {@link #USAGE} for invalid arguments
	 */
	public static int run(String... args)
	{
		ProcessCommand process = new ProcessCommand();
		CheckCommand check = new CheckCommand();

		JCommander jc = new JCommander();
		jc.addCommand(process_command, process);
		jc.addCommand(check_command, check);

		try
		{
			jc.parse(args);
		}
		catch (ParameterException e)
		{
			log.error(e.getMessage());
			jc.usage();
			return USAGE;
		}
		if (jc.getParsedCommand() == null)
		{
			jc.usage();
			return USAGE;
		}

		DateFormat dateFormat = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
		log.info(dateFormat.format(new Date()) + " running " + Arrays.stream(args).collect(joining(" ")));

		PenmanProperties properties = new PenmanProperties();
		Driver driver = new Driver(properties);
		try
		{
			if (jc.getParsedCommand().equals(process_command))
			{
				Model model = Models.get(process.model != null ? process.model : properties.getModel());
				return driver.process(process.inputFile, process.outputFile, model, driver.createOptions(process));
			}
			else
			{
				Model model = Models.get(check.model != null ? check.model : properties.getModel());
				return driver.check(check.inputFile, model);
			}
		}
		catch (PenmanException e)
		{
			log.error("Failed: " + e.getMessage());
			return FAILED;
		}
	}

	public static void main(String[] args)
	{
		int status = run(args);
		if (status != OK)
			System.exit(status);
	}
}
