package com.tsingest.ingest.parquet;

import com.tsingest.dataset.Column;
import com.tsingest.dataset.Dataset;
import com.tsingest.dataset.TimeAxis;
import com.tsingest.dataset.TimestampColumn;
import com.tsingest.ingest.columnar.CorruptColumnarFileException;
import com.tsingest.ingest.columnar.RowGroupReader;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.LocalInputFile;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a Parquet file one row group at a time.
 *
 * <p>The row count comes from the footer, so the chunking decision is made before any data page
 * is decoded. When the file carries pandas metadata naming a timestamp field as its index, that
 * field becomes the time axis.
 */
public final class ParquetRowGroupReader extends RowGroupReader {

    private static final Logger log = LoggerFactory.getLogger(ParquetRowGroupReader.class);

    static final String PANDAS_METADATA_KEY = "pandas";
    private static final Pattern PANDAS_INDEX = Pattern.compile("\"index_columns\"\\s*:\\s*\\[\\s*\"([^\"]+)\"");

    private final ParquetFileReader fileReader;
    private final MessageType schema;
    private final MessageColumnIO columnIO;
    private final List<ParquetField> fields;
    private final ParquetField timeAxisField;
    private final long rowCount;
    private final int rowGroupCount;
    private int rowGroupsRead;

    private ParquetRowGroupReader(ParquetFileReader fileReader) throws CorruptColumnarFileException {
        this.fileReader = fileReader;
        this.schema = fileReader.getFooter().getFileMetaData().getSchema();
        this.columnIO = new ColumnIOFactory().getColumnIO(schema);
        this.rowCount = fileReader.getRecordCount();
        this.rowGroupCount = fileReader.getRowGroups().size();

        List<ParquetField> mapped = new ArrayList<>();
        List<Type> types = schema.getFields();
        for (int i = 0; i < types.size(); i++) {
            Optional<ParquetField> field = ParquetField.of(i, types.get(i));
            if (field.isPresent()) {
                mapped.add(field.get());
            } else {
                log.warn("Skipping Parquet field '{}' ({}): no column counterpart", types.get(i).getName(), types.get(i));
            }
        }
        if (mapped.isEmpty()) {
            throw new CorruptColumnarFileException("No readable columns in Parquet schema");
        }
        this.fields = List.copyOf(mapped);
        this.timeAxisField = indexField(fileReader.getFooter().getFileMetaData().getKeyValueMetaData(), fields);
    }

    /**
     * Opens {@code path} and reads its footer.
     *
     * @throws CorruptColumnarFileException if the footer or schema cannot be read
     */
    public static ParquetRowGroupReader open(Path path) throws IOException {
        ParquetFileReader fileReader;
        try {
            fileReader = ParquetFileReader.open(new LocalInputFile(path));
        } catch (RuntimeException e) {
            throw new CorruptColumnarFileException("Not a Parquet file: " + e.getMessage(), e);
        }
        try {
            return new ParquetRowGroupReader(fileReader);
        } catch (IOException | RuntimeException e) {
            fileReader.close();
            throw e;
        }
    }

    @Override
    public long rowCount() {
        return rowCount;
    }

    @Override
    public boolean hasTimeAxis() {
        return timeAxisField != null;
    }

    public int rowGroupCount() {
        return rowGroupCount;
    }

    @Override
    protected boolean hasMoreRowGroups() {
        return rowGroupsRead < rowGroupCount;
    }

    @Override
    protected Dataset readRowGroup() throws IOException {
        try {
            PageReadStore pages = fileReader.readNextRowGroup();
            if (pages == null) {
                throw new CorruptColumnarFileException(
                        "Footer lists " + rowGroupCount + " row groups, found " + rowGroupsRead);
            }
            rowGroupsRead++;
            int rows = Math.toIntExact(pages.getRowCount());
            RecordReader<Group> recordReader = columnIO.getRecordReader(pages, new GroupRecordConverter(schema));
            List<Group> records = new ArrayList<>(rows);
            for (int i = 0; i < rows; i++) {
                records.add(recordReader.read());
            }
            return toDataset(records);
        } catch (RuntimeException e) {
            throw new CorruptColumnarFileException(
                    "Cannot decode row group " + rowGroupsRead + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected Dataset emptyWithSchema() {
        return toDataset(List.of());
    }

    private Dataset toDataset(List<Group> records) {
        List<Column> columns = new ArrayList<>(fields.size());
        TimeAxis axis = null;
        for (ParquetField field : fields) {
            Column column = field.decode(records);
            if (field == timeAxisField) {
                axis = new TimeAxis(field.name(), (TimestampColumn) column);
            } else {
                columns.add(column);
            }
        }
        return Dataset.of(columns, axis);
    }

    private static ParquetField indexField(Map<String, String> keyValueMetadata, List<ParquetField> fields) {
        String pandas = keyValueMetadata.get(PANDAS_METADATA_KEY);
        if (pandas == null) {
            return null;
        }
        Matcher matcher = PANDAS_INDEX.matcher(pandas);
        if (!matcher.find()) {
            return null;
        }
        String indexName = matcher.group(1);
        return fields.stream()
                .filter(f -> f.name().equals(indexName) && f.kind() == ParquetField.Kind.TIMESTAMP)
                .findFirst()
                .orElse(null);
    }

    @Override
    public void close() throws IOException {
        fileReader.close();
    }
}
