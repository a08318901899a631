package org.smap.xlsconvert.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.smap.xlsconvert.constants.XLSFormColumns;

class TableTest {

	private Table survey() {
		Table t = new Table("survey", Arrays.asList("type", "name", "style"));
		Row r = new Row();
		r.setType("text");
		r.setName("q1");
		t.addRow(r);
		return t;
	}

	@Test
	@DisplayName("copy does not share rows with the original")
	void deepCopy() {
		Table original = survey();
		Table copy = original.copy();

		copy.getRow(0).setName("changed");
		copy.addColumn("extra");

		assertThat(original.getRow(0).getName()).isEqualTo("q1");
		assertThat(original.hasColumn("extra")).isFalse();
		assertThat(copy).isNotEqualTo(original);
	}

	@Test
	@DisplayName("removing a column removes its values")
	void removeColumn() {
		Table t = survey();
		t.removeColumn("name");

		assertThat(t.getColumns()).containsExactly("type", "style");
		assertThat(t.getRow(0).getName()).isNull();
	}

	@Test
	@DisplayName("columns cannot be changed through getColumns")
	void columnsReadOnly() {
		assertThatThrownBy(() -> survey().getColumns().add("x"))
				.isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	@DisplayName("extra columns are those outside the XLSForm vocabulary")
	void extraColumns() {
		assertThat(survey().getExtraColumns(XLSFormColumns.SURVEY_COLUMNS)).containsExactly("style");
	}

	@Test
	@DisplayName("a column is blank when no row has a value")
	void blankColumn() {
		Table t = survey();
		assertThat(t.isColumnBlank("style")).isTrue();
		assertThat(t.isColumnBlank("name")).isFalse();
	}

	@Test
	@DisplayName("setting a cell to null removes it so rows stay comparable")
	void setNull() {
		Row a = new Row();
		a.setDefault("1");
		a.setDefault(null);

		assertThat(a).isEqualTo(new Row());
		assertThat(a.isEmpty()).isTrue();
	}

	@Test
	@DisplayName("NaN cells are blank")
	void nanIsBlank() {
		Row r = new Row();
		r.set("label", "NaN");

		assertThat(r.isBlank("label")).isTrue();
		assertThat(r.isEmpty()).isTrue();
	}

	@Test
	@DisplayName("state changes return new states")
	void pipelineState() {
		Table survey = survey();
		PipelineState s1 = new PipelineState(survey, null, null, "form");
		PipelineState s2 = s1.withChoices(new Table("choices"));

		assertThat(s1.getChoices()).isNull();
		assertThat(s2.getChoices()).isNotNull();
		assertThat(s2.getSurvey()).isSameAs(survey);
		assertThat(s2.getFormName()).isEqualTo("form");
	}
}
