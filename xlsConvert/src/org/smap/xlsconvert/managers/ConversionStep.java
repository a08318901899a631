package org.smap.xlsconvert.managers;

import java.util.ArrayList;

import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.model.PipelineState;

/*
 * A single step in the conversion of a form
 * A step must not change the state it is given, it returns a new state
 */
public interface ConversionStep {

	String getName();

	PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) throws ApplicationException;
}
