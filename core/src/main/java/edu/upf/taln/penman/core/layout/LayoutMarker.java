package edu.upf.taln.penman.core.layout;

import edu.upf.taln.penman.core.structures.Epidatum;

/** Epigraphical marker describing tree structure rather than surface form */
public abstract class LayoutMarker extends Epidatum
{
}
