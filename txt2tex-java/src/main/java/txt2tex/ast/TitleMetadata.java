package txt2tex.ast;

/** Values of the {@code TITLE:} family of directives; absent entries are null. */
public record TitleMetadata(
        String title,
        String subtitle,
        String author,
        String date,
        String institution
) {}
