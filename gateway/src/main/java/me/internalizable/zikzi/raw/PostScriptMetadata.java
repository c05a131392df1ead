package me.internalizable.zikzi.raw;

/**
 * Document Structuring Convention header fields of a PostScript document.
 * Absent fields are empty strings; an absent page count is 0.
 */
public class PostScriptMetadata {

    private String title = "";
    private String creator = "";
    private String creationDate = "";
    private String forUser = "";
    private int pages;
    private String boundingBox = "";

    public String getTitle() { return title; }
    void setTitle(String title) { this.title = title; }

    /**
     * The application that produced the document.
     */
    public String getCreator() { return creator; }
    void setCreator(String creator) { this.creator = creator; }

    public String getCreationDate() { return creationDate; }
    void setCreationDate(String creationDate) { this.creationDate = creationDate; }

    /**
     * The {@code %%For} value, usually the submitting user or host.
     */
    public String getFor() { return forUser; }
    void setFor(String forUser) { this.forUser = forUser; }

    public int getPages() { return pages; }
    void setPages(int pages) { this.pages = pages; }

    public String getBoundingBox() { return boundingBox; }
    void setBoundingBox(String boundingBox) { this.boundingBox = boundingBox; }

    @Override
    public String toString() {
        return "PostScriptMetadata{" +
                "title='" + title + '\'' +
                ", creator='" + creator + '\'' +
                ", for='" + forUser + '\'' +
                ", pages=" + pages +
                '}';
    }
}
