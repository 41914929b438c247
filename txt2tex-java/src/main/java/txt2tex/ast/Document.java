package txt2tex.ast;

import java.util.List;

public record Document(
        List<DocumentItem> items,
        TitleMetadata title,
        BibliographyMetadata bibliography,
        PartsFormat partsFormat
) {

    public Document {
        items = List.copyOf(items);
    }
}
