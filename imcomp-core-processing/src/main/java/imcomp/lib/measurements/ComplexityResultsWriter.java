/*-
 * #%L
 * This file is part of ImageComplexity.
 * %%
 * Copyright (C) 2024 ImageComplexity developers
 * %%
 * ImageComplexity is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * ImageComplexity is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with ImageComplexity.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package imcomp.lib.measurements;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import imcomp.lib.common.GeneralTools;

/**
 * Write measurement records as delimited text, with one header row followed by one row per image.
 * <p>
 * The first column is always {@code image}, containing the image identifier.
 */
public class ComplexityResultsWriter {

	private static final Logger logger = LoggerFactory.getLogger(ComplexityResultsWriter.class);

	/**
	 * Name of the identifier column.
	 */
	public static final String IMAGE_COLUMN = "image";

	private static final String DEFAULT_SEPARATOR = ",";

	private String separator = null;
	private int nDecimalPlaces = -1;

	/**
	 * Set the separator. If not set, this is determined from the file extension when writing to a file 
	 * ({@code .tsv} gives a tab), and is otherwise a comma.
	 * @param separator
	 * @return this writer
	 */
	public ComplexityResultsWriter separator(String separator) {
		this.separator = separator;
		return this;
	}

	/**
	 * Set the maximum number of decimal places for values, or a negative value for full precision.
	 * @param nDecimalPlaces
	 * @return this writer
	 */
	public ComplexityResultsWriter decimalPlaces(int nDecimalPlaces) {
		this.nDecimalPlaces = nDecimalPlaces;
		return this;
	}

	/**
	 * Write records to a file.
	 * @param records
	 * @param path
	 * @throws IOException
	 */
	public void write(List<MeasurementRecord> records, Path path) throws IOException {
		try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			doWrite(records, writer, getSeparatorToUse(path.getFileName().toString()));
		}
		logger.info("Wrote {} rows to {}", records.size(), path);
	}

	/**
	 * Write records to a writer. The writer is flushed but not closed.
	 * @param records
	 * @param writer
	 * @throws IOException
	 */
	public void write(List<MeasurementRecord> records, Writer writer) throws IOException {
		doWrite(records, writer, getSeparatorToUse(null));
	}

	/**
	 * Write records using the given column names.
	 * This writes a header even if there are no records.
	 * @param columns column names, excluding the image column
	 * @param records
	 * @param writer
	 * @throws IOException
	 */
	public void write(List<String> columns, List<MeasurementRecord> records, Writer writer) throws IOException {
		doWrite(columns, records, writer, getSeparatorToUse(null));
	}

	private void doWrite(List<MeasurementRecord> records, Writer writer, String separator) throws IOException {
		List<String> columns = records.isEmpty() ? List.of() : records.get(0).getColumnNames();
		doWrite(columns, records, writer, separator);
	}

	private void doWrite(List<String> columns, List<MeasurementRecord> records, Writer writer, String separator) throws IOException {
		PrintWriter printWriter = new PrintWriter(writer);
		List<String> header = new ArrayList<>();
		header.add(IMAGE_COLUMN);
		header.addAll(columns);
		writeRow(printWriter, header, separator);

		List<String> row = new ArrayList<>();
		for (MeasurementRecord record : records) {
			row.clear();
			row.add(escape(record.getImageId(), separator));
			for (String column : columns) {
				if (record.containsColumn(column))
					row.add(GeneralTools.formatNumber(record.getValue(column), nDecimalPlaces));
				else
					row.add("");
			}
			writeRow(printWriter, row, separator);
		}
		printWriter.flush();
		if (printWriter.checkError())
			throw new IOException("Error writing measurement results");
	}

	private static String escape(String value, String separator) {
		if (value.contains(separator) || value.contains("\"") || value.contains("\n"))
			return "\"" + value.replace("\"", "\"\"") + "\"";
		return value;
	}

	private String getSeparatorToUse(String filename) {
		if (separator != null)
			return separator;
		if (filename != null && filename.toLowerCase().endsWith(".tsv"))
			return "\t";
		return DEFAULT_SEPARATOR;
	}

	private static void writeRow(PrintWriter writer, List<String> strings, String delim) {
		int n = strings.size();
		for (int i = 0; i < n; i++) {
			String val = strings.get(i);
			if (val != null)
				writer.write(val);
			if (i < n-1)
				writer.write(delim);
		}
		writer.write(System.lineSeparator());
	}

}
