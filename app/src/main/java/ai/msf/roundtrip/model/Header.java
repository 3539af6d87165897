package ai.msf.roundtrip.model;

import java.util.Objects;

/**
 * Descriptive and approval metadata of an instrument document.
 */
public class Header extends MsfEntity {

    private String model = "";
    private String manufacturer = "";
    private String description = "";
    private int confidence;
    private String confidenceDescription = "";
    private String specReference = "";
    private String author = "";
    private String verifiedBy = "";
    private String approvedBy = "";
    private String approveDate = "";
    private String saveDate = "";
    private String savedBy = "";
    private int revision;
    private String appName = "";
    private String appVersion = "";
    private String sourceFilename = "";
    private String sourceDate = "";
    private int limsWidgetCode;
    private int limsEquipClass;
    private String noteIdList = "";
    private boolean active;
    private String revisionNotes = "";

    public Header(String primaryId, String secondaryId) {
        super(primaryId, secondaryId);
    }

    public String model() {
        return model;
    }

    public void setModel(String model) {
        this.model = textOrEmpty(model);
    }

    public String manufacturer() {
        return manufacturer;
    }

    public void setManufacturer(String manufacturer) {
        this.manufacturer = textOrEmpty(manufacturer);
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = textOrEmpty(description);
    }

    public int confidence() {
        return confidence;
    }

    public void setConfidence(int confidence) {
        this.confidence = confidence;
    }

    public String confidenceDescription() {
        return confidenceDescription;
    }

    public void setConfidenceDescription(String confidenceDescription) {
        this.confidenceDescription = textOrEmpty(confidenceDescription);
    }

    public String specReference() {
        return specReference;
    }

    public void setSpecReference(String specReference) {
        this.specReference = textOrEmpty(specReference);
    }

    public String author() {
        return author;
    }

    public void setAuthor(String author) {
        this.author = textOrEmpty(author);
    }

    public String verifiedBy() {
        return verifiedBy;
    }

    public void setVerifiedBy(String verifiedBy) {
        this.verifiedBy = textOrEmpty(verifiedBy);
    }

    public String approvedBy() {
        return approvedBy;
    }

    public void setApprovedBy(String approvedBy) {
        this.approvedBy = textOrEmpty(approvedBy);
    }

    public String approveDate() {
        return approveDate;
    }

    public void setApproveDate(String approveDate) {
        this.approveDate = textOrEmpty(approveDate);
    }

    public String saveDate() {
        return saveDate;
    }

    public void setSaveDate(String saveDate) {
        this.saveDate = textOrEmpty(saveDate);
    }

    public String savedBy() {
        return savedBy;
    }

    public void setSavedBy(String savedBy) {
        this.savedBy = textOrEmpty(savedBy);
    }

    public int revision() {
        return revision;
    }

    public void setRevision(int revision) {
        this.revision = revision;
    }

    public String appName() {
        return appName;
    }

    public void setAppName(String appName) {
        this.appName = textOrEmpty(appName);
    }

    public String appVersion() {
        return appVersion;
    }

    public void setAppVersion(String appVersion) {
        this.appVersion = textOrEmpty(appVersion);
    }

    public String sourceFilename() {
        return sourceFilename;
    }

    public void setSourceFilename(String sourceFilename) {
        this.sourceFilename = textOrEmpty(sourceFilename);
    }

    public String sourceDate() {
        return sourceDate;
    }

    public void setSourceDate(String sourceDate) {
        this.sourceDate = textOrEmpty(sourceDate);
    }

    public int limsWidgetCode() {
        return limsWidgetCode;
    }

    public void setLimsWidgetCode(int limsWidgetCode) {
        this.limsWidgetCode = limsWidgetCode;
    }

    public int limsEquipClass() {
        return limsEquipClass;
    }

    public void setLimsEquipClass(int limsEquipClass) {
        this.limsEquipClass = limsEquipClass;
    }

    public String noteIdList() {
        return noteIdList;
    }

    public void setNoteIdList(String noteIdList) {
        this.noteIdList = textOrEmpty(noteIdList);
    }

    public boolean active() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String revisionNotes() {
        return revisionNotes;
    }

    public void setRevisionNotes(String revisionNotes) {
        this.revisionNotes = textOrEmpty(revisionNotes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Header other)) {
            return false;
        }
        return sameEntityState(other)
                && model.equals(other.model)
                && manufacturer.equals(other.manufacturer)
                && description.equals(other.description)
                && confidence == other.confidence
                && confidenceDescription.equals(other.confidenceDescription)
                && specReference.equals(other.specReference)
                && author.equals(other.author)
                && verifiedBy.equals(other.verifiedBy)
                && approvedBy.equals(other.approvedBy)
                && approveDate.equals(other.approveDate)
                && saveDate.equals(other.saveDate)
                && savedBy.equals(other.savedBy)
                && revision == other.revision
                && appName.equals(other.appName)
                && appVersion.equals(other.appVersion)
                && sourceFilename.equals(other.sourceFilename)
                && sourceDate.equals(other.sourceDate)
                && limsWidgetCode == other.limsWidgetCode
                && limsEquipClass == other.limsEquipClass
                && noteIdList.equals(other.noteIdList)
                && active == other.active
                && revisionNotes.equals(other.revisionNotes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityStateHash(), model, manufacturer, description, confidence, confidenceDescription,
                specReference, author, verifiedBy, approvedBy, approveDate, saveDate, savedBy, revision, appName,
                appVersion, sourceFilename, sourceDate, limsWidgetCode, limsEquipClass, noteIdList, active,
                revisionNotes);
    }

    @Override
    public String toString() {
        return "Header{" + manufacturer + ' ' + model + '}';
    }
}
