package edu.upf.taln.penman.tools;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;

public class DriverTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path write(String name, String text) throws IOException
	{
		Path file = folder.getRoot().toPath().resolve(name);
		Assert.assertTrue(FileUtils.writeTextToFile(file, text));
		return file;
	}

	@Test
	public void testProcess() throws IOException
	{
		Path input = write("in.penman", "# ::id 1\n(a / alpha\n   :ARG0 (b / beta))\n\n(g / gamma)\n");
		Path output = folder.getRoot().toPath().resolve("out.penman");

		int status = Driver.run("process", "-i", input.toString(), "-o", output.toString(), "--indent", "flat");
		Assert.assertEquals(Driver.OK, status);
		Assert.assertEquals("# ::id 1\n(a / alpha :ARG0 (b / beta))\n\n(g / gamma)\n", FileUtils.readTextFile(output));
	}

	@Test
	public void testProcessWithModel() throws IOException
	{
		Path input = write("in.penman", "(a / alpha :mod 5)");
		Path output = folder.getRoot().toPath().resolve("out.penman");

		int status = Driver.run("process", "-i", input.toString(), "-o", output.toString(), "--indent", "flat",
				"-m", "amr", "--reify-edges");
		Assert.assertEquals(Driver.OK, status);
		Assert.assertEquals("(a / alpha :ARG1-of (_ / have-mod-91 :ARG2 5))\n", FileUtils.readTextFile(output));
	}

	@Test
	public void testProcessTriples() throws IOException
	{
		Path input = write("in.penman", "(a / alpha :ARG0 (b / beta))");
		Path output = folder.getRoot().toPath().resolve("out.txt");

		int status = Driver.run("process", "-i", input.toString(), "-o", output.toString(), "--indent", "flat",
				"--triples");
		Assert.assertEquals(Driver.OK, status);
		Assert.assertEquals("instance(a, alpha) ^ ARG0(a, b) ^ instance(b, beta)\n", FileUtils.readTextFile(output));
	}

	@Test
	public void testProcessInvalidGraph() throws IOException
	{
		Path input = write("in.penman", "(a / alpha");
		Path output = folder.getRoot().toPath().resolve("out.penman");
		Assert.assertEquals(Driver.FAILED, Driver.run("process", "-i", input.toString(), "-o", output.toString()));
	}

	@Test
	public void testCheck() throws IOException
	{
		Path valid = write("valid.penman", "(a / alpha :ARG0 (b / beta) :mod-of (g / gamma))");
		Assert.assertEquals(Driver.OK, Driver.run("check", "-i", valid.toString(), "-m", "amr"));

		Path invalid = write("invalid.penman", "(a / alpha :ARG0 (b / beta))\n\n(a / alpha :foo b)");
		Assert.assertEquals(Driver.FAILED, Driver.run("check", "-i", invalid.toString(), "-m", "amr"));
	}

	@Test
	public void testCheckWithModelFile() throws IOException
	{
		Path model = write("model.json", "{\"roles\": {\":foo\": {\"type\": \"general\"}}}");
		Path input = write("in.penman", "(a / alpha :foo b)");
		Assert.assertEquals(Driver.OK, Driver.run("check", "-i", input.toString(), "-m", model.toString()));
	}

	@Test
	public void testUsage() throws IOException
	{
		Assert.assertEquals(Driver.USAGE, Driver.run());
		Assert.assertEquals(Driver.USAGE, Driver.run("process"));
		Assert.assertEquals(Driver.USAGE, Driver.run("process", "-i", folder.getRoot().toPath().resolve("missing").toString()));

		Path input = write("in.penman", "(a / alpha)");
		Assert.assertEquals(Driver.USAGE, Driver.run("process", "-i", input.toString(), "--indent", "wide"));
		Assert.assertEquals(Driver.USAGE, Driver.run("process", "-i", input.toString(), "--rearrange", "sideways"));
		Assert.assertEquals(Driver.USAGE, Driver.run("check", "-i", input.toString(), "-m", "xyz"));
	}
}
