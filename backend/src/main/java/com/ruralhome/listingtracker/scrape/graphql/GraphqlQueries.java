package com.ruralhome.listingtracker.scrape.graphql;

final class GraphqlQueries {
    static final String SEARCH_OPERATION = "ConsumerSearchQuery";
    static final String DETAIL_OPERATION = "FullPropertyDetails";

    static final String SEARCH_QUERY = """
        query ConsumerSearchQuery(
          $query: HomeSearchCriteria!
          $limit: Int
          $offset: Int
          $sort: [SearchAPISort]
        ) {
          home_search(query: $query, limit: $limit, offset: $offset, sort: $sort) {
            total
            results {
              property_id
              listing_id
              permalink
              list_price
              list_date
              location {
                address { line city state_code postal_code }
                county { name }
              }
              description { sqft beds baths }
              advertisers {
                name
                href
                phones { number type primary }
              }
            }
          }
        }
        """;

    static final String DETAIL_QUERY = """
        query FullPropertyDetails($propertyId: ID!, $listingId: ID) {
          home(property_id: $propertyId, listing_id: $listingId) {
            property_id
            listing_id
            permalink
            list_price
            list_date
            status
            description { text sqft beds baths lot_sqft year_built }
            details { category parent_category text }
            location {
              address { line city state_code postal_code }
              county { name }
            }
            advertisers {
              name
              href
              type
              phones { number primary type }
              broker { name }
              office { name }
            }
            source {
              agents { agent_name agent_phone office_name }
            }
          }
        }
        """;

    private GraphqlQueries() {
    }
}
