package edu.upf.taln.penman.core.structures;

/**
 * Base class of epigraphical markers: data attached to a triple that describes how it was (or should be) written,
 * without being part of the pure graph.
 */
public abstract class Epidatum
{
	/** Which part of a serialized branch a marker is rendered on. */
	public enum Mode {UNSPECIFIED, ROLE, TARGET}

	public Mode getMode()
	{
		return Mode.UNSPECIFIED;
	}
}
