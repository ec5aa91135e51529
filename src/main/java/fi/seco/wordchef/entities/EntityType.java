package fi.seco.wordchef.entities;

/**
 * Entity categories. Each is recognized by its own
 * {@code <lang>-ner-<modelName>.bin} OpenNLP model.
 */
public enum EntityType {
	PERSON("person"), LOCATION("location"), ORGANIZATION("organization"), DATE("date"), QUANTITY("quantity");

	private final String modelName;

	private EntityType(String modelName) {
		this.modelName = modelName;
	}

	public String getModelName() {
		return modelName;
	}
}
