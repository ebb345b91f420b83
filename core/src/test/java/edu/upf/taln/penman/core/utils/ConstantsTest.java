package edu.upf.taln.penman.core.utils;

import edu.upf.taln.penman.core.ConstantException;
import org.junit.Assert;
import org.junit.Test;

public class ConstantsTest
{
	@Test
	public void testIsNull()
	{
		Assert.assertTrue(Constants.isNull(null));
		Assert.assertTrue(Constants.isNull(""));
		Assert.assertFalse(Constants.isNull("\"\""));
		Assert.assertFalse(Constants.isNull("-"));
	}

	@Test
	public void testType()
	{
		Assert.assertEquals(Constants.Type.NULL, Constants.type(null));
		Assert.assertEquals(Constants.Type.NULL, Constants.type(""));
		Assert.assertEquals(Constants.Type.SYMBOL, Constants.type("foo"));
		Assert.assertEquals(Constants.Type.SYMBOL, Constants.type(":foo"));
		Assert.assertEquals(Constants.Type.SYMBOL, Constants.type("-"));
		Assert.assertEquals(Constants.Type.SYMBOL, Constants.type("true"));
		Assert.assertEquals(Constants.Type.STRING, Constants.type("\"foo\""));
		Assert.assertEquals(Constants.Type.STRING, Constants.type("\"\""));
		Assert.assertEquals(Constants.Type.INTEGER, Constants.type("42"));
		Assert.assertEquals(Constants.Type.INTEGER, Constants.type("-7"));
		Assert.assertEquals(Constants.Type.FLOAT, Constants.type("3.14"));
		Assert.assertEquals(Constants.Type.FLOAT, Constants.type("-1.0e-2"));
		Assert.assertEquals(Constants.Type.SYMBOL, Constants.type("876-9"));
		Assert.assertEquals(Constants.Type.SYMBOL, Constants.type("01"));
	}

	@Test
	public void testEvaluate()
	{
		Assert.assertNull(Constants.evaluate(null));
		Assert.assertNull(Constants.evaluate(""));
		Assert.assertEquals("foo", Constants.evaluate("foo"));
		Assert.assertEquals("true", Constants.evaluate("true"));
		Assert.assertEquals("foo", Constants.evaluate("\"foo\""));
		Assert.assertEquals("a \"quoted\" word", Constants.evaluate("\"a \\\"quoted\\\" word\""));
		Assert.assertEquals(42L, Constants.evaluate("42"));
		Assert.assertEquals(3.14, Constants.evaluate("3.14"));
		Assert.assertEquals(-0.01, Constants.evaluate("-1.0e-2"));
	}

	@Test(expected = ConstantException.class)
	public void testUnbalancedQuotes()
	{
		Constants.evaluate("\"foo");
	}

	@Test(expected = ConstantException.class)
	public void testSingleQuote()
	{
		Constants.type("\"");
	}

	@Test
	public void testQuote()
	{
		Assert.assertEquals("\"foo\"", Constants.quote("foo"));
		Assert.assertEquals("\"\\\"foo\\\"\"", Constants.quote("\"foo\""));
		Assert.assertEquals("\"\"", Constants.quote(""));
		Assert.assertEquals("\"\"", Constants.quote(null));
		Assert.assertEquals("\"42\"", Constants.quote(42));
		Assert.assertEquals("\"<a&b>\"", Constants.quote("<a&b>"));
	}
}
