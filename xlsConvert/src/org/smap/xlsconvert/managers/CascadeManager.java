package org.smap.xlsconvert.managers;

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.ResourceBundle;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.smap.xlsconvert.Utilities.ApplicationException;
import org.smap.xlsconvert.Utilities.ApplicationWarning;
import org.smap.xlsconvert.Utilities.ConvertSettings;
import org.smap.xlsconvert.Utilities.XLSUtilities;
import org.smap.xlsconvert.constants.XLSFormColumns;
import org.smap.xlsconvert.model.LocationHierarchy;
import org.smap.xlsconvert.model.LocationItem;
import org.smap.xlsconvert.model.LocationList;
import org.smap.xlsconvert.model.PipelineState;
import org.smap.xlsconvert.model.Row;
import org.smap.xlsconvert.model.Table;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/*
 * Replace the location choice lists with the standard location hierarchy
 * Each level after the first has a column named after its parent list which is used by choice filters
 */
public class CascadeManager extends StepManager {

	private static Logger log =
			 Logger.getLogger(CascadeManager.class.getName());

	private LocationHierarchy hierarchy;

	public CascadeManager(ResourceBundle l, LocationHierarchy hierarchy) {
		super(l);
		this.hierarchy = hierarchy;
	}

	@Override
	public String getName() {
		return "Fix Cascading Selects";
	}

	@Override
	public PipelineState apply(PipelineState state, ArrayList<ApplicationWarning> warnings) {
		return state.withChoices(fixCascades(state.getChoices(), warnings));
	}

	public Table fixCascades(Table in, ArrayList<ApplicationWarning> warnings) {

		Table choices;
		if(in == null || in.size() == 0) {
			choices = new Table(XLSFormColumns.CHOICES_SHEET);
			addWarning(warnings, "cv_loc_seed", -1, XLSFormColumns.CHOICES_SHEET, null, null, null);
		} else {
			choices = new Table(in.getName(), in.getColumns());

			ArrayList<String> reserved = hierarchy.getListNames();
			HashMap<String, Integer> replaced = new LinkedHashMap<> ();
			for(Row r : in.getRows()) {
				String listName = r.getListName();
				if(listName != null && reserved.contains(listName)) {
					Integer count = replaced.get(listName);
					replaced.put(listName, count == null ? 1 : count + 1);
				} else {
					choices.addRow(new Row(r));
				}
			}
			for(String listName : replaced.keySet()) {
				addWarning(warnings, "cv_loc", -1, XLSFormColumns.CHOICES_SHEET,
						String.valueOf(replaced.get(listName)), listName, null);
			}
		}

		addSeedRows(choices);
		log.info("Location lists added: " + hierarchy.size() + " choices");
		return choices;
	}

	/*
	 * Get the rows for the location lists
	 */
	public Table getSeedRows() {
		Table seed = new Table(XLSFormColumns.CHOICES_SHEET);
		addSeedRows(seed);
		return seed;
	}

	private void addSeedRows(Table choices) {
		choices.addColumn(XLSFormColumns.LIST_NAME);
		choices.addColumn(XLSFormColumns.NAME);
		choices.addColumn(XLSFormColumns.LABEL_ENGLISH);
		choices.addColumn(XLSFormColumns.LABEL_ARABIC);
		for(LocationList list : hierarchy.lists) {
			if(list.parent_list != null) {
				choices.addColumn(list.parent_list);
			}
		}

		for(LocationList list : hierarchy.lists) {
			for(LocationItem item : list.items) {
				Row r = new Row();
				r.setListName(list.list_name);
				r.setName(item.name);
				r.set(XLSFormColumns.LABEL_ENGLISH, item.label_english);
				r.set(XLSFormColumns.LABEL_ARABIC, item.label_arabic);
				if(list.parent_list != null) {
					r.set(list.parent_list, item.parent);
				}
				choices.addRow(r);
			}
		}
	}

	/*
	 * Load the location hierarchy named in the settings from the classpath
	 */
	public static LocationHierarchy loadHierarchy(ResourceBundle localisation, ConvertSettings settings) throws ApplicationException {

		String resource = settings.getLocationHierarchy();
		LocationHierarchy h = null;
		try (InputStream is = CascadeManager.class.getClassLoader().getResourceAsStream(resource)) {
			if(is == null) {
				throw XLSUtilities.getApplicationException(localisation, "cv_hier", -1, null, resource, "not found", null);
			}
			h = readHierarchy(localisation, new InputStreamReader(is, StandardCharsets.UTF_8), resource);
		} catch (ApplicationException e) {
			throw e;
		} catch (Exception e) {
			log.log(Level.SEVERE, "Error loading location hierarchy", e);
			throw new ApplicationException(XLSUtilities.getMessage(localisation, "cv_hier", -1, null,
					resource, e.getMessage(), null), e);
		}
		return h;
	}

	/*
	 * Parse and validate a location hierarchy
	 */
	public static LocationHierarchy readHierarchy(ResourceBundle localisation, Reader reader, String source) throws ApplicationException {

		Gson gson = new GsonBuilder().disableHtmlEscaping().create();
		LocationHierarchy h = null;
		try {
			h = gson.fromJson(reader, LocationHierarchy.class);
		} catch (Exception e) {
			log.log(Level.SEVERE, "Error parsing location hierarchy", e);
			throw new ApplicationException(XLSUtilities.getMessage(localisation, "cv_hier", -1, null,
					source, e.getMessage(), null), e);
		}

		if(h == null || h.lists == null || h.lists.isEmpty()) {
			throw XLSUtilities.getApplicationException(localisation, "cv_hier", -1, null, source, "no lists", null);
		}

		// Every parent must be a location in the parent list
		HashMap<String, HashSet<String>> names = new HashMap<> ();
		for(LocationList list : h.lists) {
			if(list.list_name == null || list.items == null) {
				throw XLSUtilities.getApplicationException(localisation, "cv_hier", -1, null, source, "list without a name or items", null);
			}
			HashSet<String> listItems = new HashSet<> ();
			for(LocationItem item : list.items) {
				listItems.add(item.name);
			}
			names.put(list.list_name, listItems);
		}
		for(LocationList list : h.lists) {
			if(list.parent_list == null) {
				continue;
			}
			HashSet<String> parents = names.get(list.parent_list);
			for(LocationItem item : list.items) {
				if(parents == null || !parents.contains(item.parent)) {
					throw XLSUtilities.getApplicationException(localisation, "cv_hier_parent", -1, null,
							item.name, list.list_name, item.parent);
				}
			}
		}

		return h;
	}
}
