package lpp.model.context;

public enum CompartmentType {
	NON_SPATIAL,
	CONTAINER
}
